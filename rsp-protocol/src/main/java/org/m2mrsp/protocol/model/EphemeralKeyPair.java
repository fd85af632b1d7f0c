package org.m2mrsp.protocol.model;

import java.math.BigInteger;

/**
 * Per-attempt P-256 key pair used in key establishment.
 *
 * @param privateScalar private scalar in [1, n-1]
 * @param publicKey     uncompressed SEC1 encoding of the public point (65 bytes)
 */
public record EphemeralKeyPair(BigInteger privateScalar, byte[] publicKey) {

  @Override
  public String toString() {
    return "EphemeralKeyPair[publicKey=" + publicKey.length + " bytes]";
  }
}
