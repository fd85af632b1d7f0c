package org.m2mrsp.protocol.crypto;

import static org.m2mrsp.protocol.crypto.RspCrypto.concat;
import static org.m2mrsp.protocol.crypto.RspCrypto.int32;

import java.nio.charset.StandardCharsets;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;
import org.m2mrsp.protocol.model.DerivedKeySet;

/**
 * NIST SP 800-108 key derivation in counter mode with HMAC-SHA256 as the PRF.
 * <p>
 * Block {@code i} (starting at 1) is
 * {@code HMAC(key, BE32(i) || label || 0x00 || context || BE32(outLen * 8))}; blocks are
 * concatenated and truncated to {@code outLen}.
 */
public final class NistKdf {

  public static final String LABEL_PREFIX = "M2M_RSP_";
  public static final String ENCRYPTION_KEY = "encryption_key";
  public static final String MAC_KEY = "mac_key";
  public static final String USAGE_KEY = "usage_key";
  public static final byte[] KEY_SET_CONTEXT = "scp03t".getBytes(StandardCharsets.US_ASCII);
  public static final int KEY_SET_KEY_LENGTH = 32;

  private static final int HASH_LEN = 32;
  private static final byte[] SEPARATOR = {0x00};

  private NistKdf() {
  }

  /**
   * Raw counter-mode derivation.
   *
   * @param key          PRF key
   * @param outputLength bytes of output, must be positive
   * @param label        label bytes
   * @param context      context bytes
   * @return derived bytes
   */
  public static byte[] derive(byte[] key, int outputLength, byte[] label, byte[] context) {
    if (outputLength <= 0) {
      throw new IllegalArgumentException("outputLength must be positive: " + outputLength);
    }
    HMac hmac = new HMac(new SHA256Digest());
    hmac.init(new KeyParameter(key));
    byte[] fixedInput = concat(label, SEPARATOR, context, int32(outputLength * 8));
    byte[] result = new byte[outputLength];
    byte[] block = new byte[HASH_LEN];
    int copied = 0;
    int counter = 1;
    while (copied < outputLength) {
      hmac.reset();
      byte[] i = int32(counter);
      hmac.update(i, 0, i.length);
      hmac.update(fixedInput, 0, fixedInput.length);
      hmac.doFinal(block, 0);
      int toCopy = Math.min(outputLength - copied, HASH_LEN);
      System.arraycopy(block, 0, result, copied, toCopy);
      copied += toCopy;
      counter++;
    }
    return result;
  }

  /**
   * Derives a typed key with label {@code "M2M_RSP_" + keyType}.
   */
  public static byte[] deriveKey(byte[] secret, int length, String keyType, byte[] context) {
    byte[] label = (LABEL_PREFIX + keyType).getBytes(StandardCharsets.US_ASCII);
    return derive(secret, length, label, context);
  }

  /**
   * Derives {Ke, Km, Ku} from an ECDH shared secret.
   */
  public static DerivedKeySet deriveKeySet(byte[] sharedSecret) {
    return new DerivedKeySet(
        deriveKey(sharedSecret, KEY_SET_KEY_LENGTH, ENCRYPTION_KEY, KEY_SET_CONTEXT),
        deriveKey(sharedSecret, KEY_SET_KEY_LENGTH, MAC_KEY, KEY_SET_CONTEXT),
        deriveKey(sharedSecret, KEY_SET_KEY_LENGTH, USAGE_KEY, KEY_SET_CONTEXT));
  }
}
