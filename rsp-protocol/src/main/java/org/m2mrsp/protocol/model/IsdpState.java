package org.m2mrsp.protocol.model;

/**
 * ISD-P lifecycle states. DELETED is terminal.
 */
public enum IsdpState {
  CREATED,
  UPLOADED,
  INSTALLED,
  ENABLED,
  DISABLED,
  DELETED
}
