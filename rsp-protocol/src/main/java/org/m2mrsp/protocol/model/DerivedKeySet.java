package org.m2mrsp.protocol.model;

import java.util.Arrays;

/**
 * The three 32-byte keys both sides derive from the ECDH shared secret.
 *
 * @param ke encryption key
 * @param km MAC key, used for key confirmation
 * @param ku usage key
 */
public record DerivedKeySet(byte[] ke, byte[] km, byte[] ku) {

  @Override
  public boolean equals(Object o) {
    return o instanceof DerivedKeySet other
        && Arrays.equals(ke, other.ke)
        && Arrays.equals(km, other.km)
        && Arrays.equals(ku, other.ku);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * Arrays.hashCode(ke) + Arrays.hashCode(km)) + Arrays.hashCode(ku);
  }

  @Override
  public String toString() {
    return "DerivedKeySet[redacted]";
  }
}
