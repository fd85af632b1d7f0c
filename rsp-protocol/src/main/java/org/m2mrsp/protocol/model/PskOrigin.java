package org.m2mrsp.protocol.model;

/**
 * How a pre-shared key came to exist.
 */
public enum PskOrigin {
  REGISTRATION,
  KEY_ESTABLISHMENT
}
