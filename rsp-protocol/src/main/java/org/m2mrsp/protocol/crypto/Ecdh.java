package org.m2mrsp.protocol.crypto;

import java.math.BigInteger;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.util.BigIntegers;
import org.m2mrsp.protocol.RandomProvider;
import org.m2mrsp.protocol.exception.InvalidPublicKeyException;
import org.m2mrsp.protocol.model.EphemeralKeyPair;

/**
 * Elliptic curve Diffie-Hellman over NIST P-256.
 * <p>
 * Public keys are 65-byte uncompressed SEC1 points. The shared secret is the 32-byte
 * big-endian x-coordinate of {@code d * Q}. Stateless apart from the random source, so a
 * single instance may be shared across threads.
 */
public class Ecdh {

  public static final String CURVE_NAME = "secp256r1";
  public static final int PUBLIC_KEY_LENGTH = 65;
  public static final int SHARED_SECRET_LENGTH = 32;
  public static final int CHALLENGE_LENGTH = 16;

  static final ECDomainParameters P256;

  static {
    X9ECParameters params = CustomNamedCurves.getByName(CURVE_NAME);
    P256 = new ECDomainParameters(params.getCurve(), params.getG(), params.getN(), params.getH());
  }

  private final RandomProvider randomProvider;

  public Ecdh(RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  public Ecdh() {
    this(new RandomProvider());
  }

  /**
   * Generates a fresh ephemeral key pair.
   *
   * @return the key pair
   */
  public EphemeralKeyPair generateKeyPair() {
    BigInteger d = randomProvider.randomScalar(P256.getN());
    ECPoint q = P256.getG().multiply(d).normalize();
    return new EphemeralKeyPair(d, q.getEncoded(false));
  }

  /**
   * Computes the shared secret between a local private scalar and a peer public key.
   *
   * @param privateScalar local private scalar
   * @param peerPublicKey peer uncompressed public key
   * @return the 32-byte x-coordinate
   * @throws InvalidPublicKeyException if the peer key is malformed
   */
  public byte[] computeSharedSecret(BigInteger privateScalar, byte[] peerPublicKey) {
    ECPoint peer = decodePublicKey(peerPublicKey);
    ECPoint shared = peer.multiply(privateScalar).normalize();
    if (shared.isInfinity()) {
      throw new InvalidPublicKeyException("Shared point is the identity element");
    }
    return BigIntegers.asUnsignedByteArray(SHARED_SECRET_LENGTH,
        shared.getAffineXCoord().toBigInteger());
  }

  /**
   * Generates a 16-byte random challenge.
   *
   * @return the challenge
   */
  public byte[] generateRandomChallenge() {
    return randomProvider.randomBytes(CHALLENGE_LENGTH);
  }

  /**
   * Decodes and validates an uncompressed P-256 public key.
   *
   * <p>Checks performed:
   * <ol>
   *   <li>Length is 65 and the prefix byte is {@code 0x04}.</li>
   *   <li>The coordinates decode to a point.</li>
   *   <li>The point is not the identity and lies on the curve.</li>
   * </ol>
   * P-256 has cofactor 1, so no subgroup check is needed.
   *
   * @param encoded the encoded point
   * @return the validated point
   * @throws InvalidPublicKeyException if any check fails
   */
  public static ECPoint decodePublicKey(byte[] encoded) {
    if (encoded == null || encoded.length != PUBLIC_KEY_LENGTH || encoded[0] != 0x04) {
      throw new InvalidPublicKeyException("Public key must be a 65-byte uncompressed P-256 point");
    }
    ECPoint p;
    try {
      p = P256.getCurve().decodePoint(encoded);
    } catch (IllegalArgumentException e) {
      throw new InvalidPublicKeyException("Public key does not decode to a P-256 point", e);
    }
    if (p.isInfinity()) {
      throw new InvalidPublicKeyException("Public key is the identity element");
    }
    if (!p.isValid()) {
      throw new InvalidPublicKeyException("Public key is not on the P-256 curve");
    }
    return p;
  }
}
