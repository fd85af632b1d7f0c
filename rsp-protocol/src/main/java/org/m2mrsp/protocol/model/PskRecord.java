package org.m2mrsp.protocol.model;

import java.time.Instant;

/**
 * The live pre-shared key of one eUICC.
 */
public record PskRecord(String euiccId, byte[] psk, Instant registeredAt, PskOrigin origin) {

  @Override
  public String toString() {
    return "PskRecord[euiccId=" + euiccId + ", length=" + psk.length + ", origin=" + origin + "]";
  }
}
