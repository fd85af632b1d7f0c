package org.m2mrsp.protocol;

import java.math.BigInteger;
import java.security.SecureRandom;
import org.bouncycastle.util.BigIntegers;
import org.bouncycastle.util.encoders.Hex;

/**
 * Single source of randomness for the protocol: challenges, IVs, ISD-P identifiers, SIM keys,
 * transport PSKs and ephemeral EC scalars all come from here, so tests can substitute a seeded
 * {@link SecureRandom}.
 */
public final class RandomProvider {

  private final SecureRandom random;

  public RandomProvider(SecureRandom random) {
    this.random = random;
  }

  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * @param len number of bytes
   * @return fresh random bytes
   */
  public byte[] randomBytes(int len) {
    if (len <= 0) {
      throw new IllegalArgumentException("Length must be positive: " + len);
    }
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Random bytes rendered as upper-case hex, two characters per byte.
   */
  public String randomHex(int len) {
    return Hex.toHexString(randomBytes(len)).toUpperCase();
  }

  /**
   * Uniform scalar in {@code [1, order - 1]}.
   *
   * @param order group order
   * @return a valid private scalar
   */
  public BigInteger randomScalar(BigInteger order) {
    return BigIntegers.createRandomInRange(BigInteger.ONE, order.subtract(BigInteger.ONE), random);
  }
}
