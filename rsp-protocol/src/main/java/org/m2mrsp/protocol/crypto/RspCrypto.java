package org.m2mrsp.protocol.crypto;

import java.nio.charset.StandardCharsets;
import java.util.HexFormat;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.Arrays;

/**
 * Byte-level helpers shared by the protocol primitives.
 * Wraps BouncyCastle SHA-256 and HMAC-SHA256.
 */
public final class RspCrypto {

  private static final HexFormat HEX = HexFormat.of();

  private RspCrypto() {
  }

  /**
   * SHA-256(data).
   */
  public static byte[] sha256(byte[] data) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(data, 0, data.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return out;
  }

  /**
   * Lower-case hex SHA-256 of the UTF-8 encoding of {@code text}.
   */
  public static String sha256Hex(String text) {
    return HEX.formatHex(sha256(text.getBytes(StandardCharsets.UTF_8)));
  }

  /**
   * HMAC-SHA256(key, parts[0] || parts[1] || ...).
   */
  public static byte[] hmacSha256(byte[] key, byte[]... parts) {
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(key));
    for (byte[] part : parts) {
      hmac.update(part, 0, part.length);
    }
    byte[] out = new byte[hmac.getMacSize()];
    hmac.doFinal(out, 0);
    return out;
  }

  /**
   * Concatenates byte arrays in order.
   */
  public static byte[] concat(byte[]... arrays) {
    int len = 0;
    for (byte[] a : arrays) {
      len += a.length;
    }
    byte[] result = new byte[len];
    int offset = 0;
    for (byte[] a : arrays) {
      System.arraycopy(a, 0, result, offset, a.length);
      offset += a.length;
    }
    return result;
  }

  /**
   * Big-endian 4-byte encoding of {@code value}.
   */
  public static byte[] int32(int value) {
    return new byte[]{
        (byte) (value >>> 24), (byte) (value >>> 16), (byte) (value >>> 8), (byte) value};
  }

  /**
   * Constant-time comparison; {@code false} when either side is null.
   */
  public static boolean constantTimeEquals(byte[] a, byte[] b) {
    if (a == null || b == null) {
      return false;
    }
    return Arrays.constantTimeAreEqual(a, b);
  }

  public static String toHex(byte[] bytes) {
    return HEX.formatHex(bytes);
  }

  public static byte[] fromHex(String hex) {
    return HEX.parseHex(hex);
  }
}
