package org.m2mrsp.protocol.model;

import java.util.Arrays;

/**
 * SCP03t session keys, 16 bytes each.
 *
 * @param sEnc  command encryption key
 * @param sMac  command MAC key
 * @param sRmac response MAC key
 */
public record SessionKeys(byte[] sEnc, byte[] sMac, byte[] sRmac) {

  @Override
  public boolean equals(Object o) {
    return o instanceof SessionKeys other
        && Arrays.equals(sEnc, other.sEnc)
        && Arrays.equals(sMac, other.sMac)
        && Arrays.equals(sRmac, other.sRmac);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(sEnc) + Arrays.hashCode(sMac)) + Arrays.hashCode(sRmac);
  }

  @Override
  public String toString() {
    return "SessionKeys[redacted]";
  }
}
