package org.m2mrsp.protocol.model;

/**
 * ES8 commands SM-SR sends to an eUICC.
 */
public enum Es8CommandType {
  CREATE_ISDP,
  ENABLE_PROFILE,
  DISABLE_PROFILE,
  DELETE_ISDP
}
