package org.m2mrsp.protocol.crypto;

import static org.m2mrsp.protocol.crypto.RspCrypto.concat;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.BufferedBlockCipher;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.m2mrsp.protocol.RandomProvider;
import org.m2mrsp.protocol.exception.DecryptionFailedException;
import org.m2mrsp.protocol.exception.InvalidKeyLengthException;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.model.PskEnvelope;

/**
 * Pre-shared key transport cipher used between SM-SR and an eUICC.
 * <p>
 * For each message a fresh 16-byte IV is drawn. Two 32-byte keys are stretched from the PSK
 * with PBKDF2-HMAC-SHA256: the encryption key with salt {@code iv}, the MAC key with salt
 * {@code iv || "mac_key"}. The payload is AES-CBC/PKCS#7 encrypted and authenticated with
 * HMAC-SHA256 over {@code iv || ciphertext}.
 * <p>
 * Decryption verifies the MAC first and never opens an envelope that has none.
 */
public class PskCipher {

  public static final int DEFAULT_ITERATIONS = 10_000;
  public static final int IV_LENGTH = 16;

  private static final int DERIVED_KEY_BITS = 256;
  private static final byte[] MAC_SALT_SUFFIX = "mac_key".getBytes(StandardCharsets.US_ASCII);

  private final int iterations;
  private final RandomProvider randomProvider;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new PSK cipher.
   *
   * @param iterations     PBKDF2 iteration count
   * @param randomProvider IV source
   * @param objectMapper   serializer for object payloads
   */
  public PskCipher(int iterations, RandomProvider randomProvider, ObjectMapper objectMapper) {
    if (iterations < 1) {
      throw new IllegalArgumentException("iterations must be positive: " + iterations);
    }
    this.iterations = iterations;
    this.randomProvider = randomProvider;
    this.objectMapper = objectMapper;
  }

  public PskCipher() {
    this(DEFAULT_ITERATIONS, new RandomProvider(), new ObjectMapper());
  }

  /**
   * Encrypts and authenticates raw bytes.
   *
   * @throws InvalidKeyLengthException if the PSK is not 16 or 32 bytes
   */
  public PskEnvelope encrypt(byte[] plaintext, byte[] psk) {
    String keyType = keyType(psk);
    byte[] iv = randomProvider.randomBytes(IV_LENGTH);
    BufferedBlockCipher cipher = cbc(true, pbkdf2(psk, iv), iv);
    byte[] out = new byte[cipher.getOutputSize(plaintext.length)];
    int len = cipher.processBytes(plaintext, 0, plaintext.length, out, 0);
    try {
      len += cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("Padding failed while encrypting", e);
    }
    byte[] ciphertext = Arrays.copyOf(out, len);
    byte[] mac = RspCrypto.hmacSha256(pbkdf2(psk, concat(iv, MAC_SALT_SUFFIX)), iv, ciphertext);
    return new PskEnvelope(iv, ciphertext, mac, keyType);
  }

  /**
   * Serializes {@code payload} as JSON and encrypts it.
   */
  public PskEnvelope encryptObject(Object payload, byte[] psk) {
    try {
      return encrypt(objectMapper.writeValueAsBytes(payload), psk);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Payload is not serializable: "
          + payload.getClass().getSimpleName(), e);
    }
  }

  /**
   * Verifies and decrypts an envelope.
   *
   * @throws MacVerificationFailedException if the MAC is missing or wrong (including wrong PSK)
   * @throws DecryptionFailedException      if the authenticated ciphertext does not decrypt
   */
  public byte[] decrypt(PskEnvelope envelope, byte[] psk) {
    keyType(psk);
    byte[] iv = envelope.iv();
    if (envelope.mac() == null) {
      throw new MacVerificationFailedException("Envelope carries no MAC");
    }
    if (iv == null || iv.length != IV_LENGTH || envelope.data() == null) {
      throw new DecryptionFailedException("Envelope is missing its IV or data");
    }
    byte[] expected = RspCrypto.hmacSha256(pbkdf2(psk, concat(iv, MAC_SALT_SUFFIX)),
        iv, envelope.data());
    if (!RspCrypto.constantTimeEquals(expected, envelope.mac())) {
      throw new MacVerificationFailedException("PSK envelope MAC mismatch");
    }
    byte[] data = envelope.data();
    if (data.length == 0 || data.length % IV_LENGTH != 0) {
      throw new DecryptionFailedException("Ciphertext length is not a multiple of the block size");
    }
    BufferedBlockCipher cipher = cbc(false, pbkdf2(psk, iv), iv);
    byte[] out = new byte[cipher.getOutputSize(data.length)];
    try {
      int len = cipher.processBytes(data, 0, data.length, out, 0);
      len += cipher.doFinal(out, len);
      return Arrays.copyOf(out, len);
    } catch (InvalidCipherTextException | DataLengthException e) {
      throw new DecryptionFailedException("PSK decryption failed", e);
    }
  }

  /**
   * Verifies, decrypts and deserializes an envelope.
   */
  public <T> T decryptObject(PskEnvelope envelope, byte[] psk, Class<T> type) {
    byte[] json = decrypt(envelope, psk);
    try {
      return objectMapper.readValue(json, type);
    } catch (IOException e) {
      throw new DecryptionFailedException("Decrypted payload is not a " + type.getSimpleName(), e);
    }
  }

  /**
   * Maps a PSK to its reported key type.
   *
   * @throws InvalidKeyLengthException for any length other than 16 or 32
   */
  public static String keyType(byte[] psk) {
    if (psk == null) {
      throw new InvalidKeyLengthException("PSK is absent");
    }
    return switch (psk.length) {
      case 16 -> "AES-128";
      case 32 -> "AES-256";
      default -> throw new InvalidKeyLengthException("PSK must be 16 or 32 bytes, got " + psk.length);
    };
  }

  private byte[] pbkdf2(byte[] psk, byte[] salt) {
    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
    generator.init(psk, salt, iterations);
    return ((KeyParameter) generator.generateDerivedParameters(DERIVED_KEY_BITS)).getKey();
  }

  private static BufferedBlockCipher cbc(boolean encrypt, byte[] key, byte[] iv) {
    PaddedBufferedBlockCipher cipher = new PaddedBufferedBlockCipher(
        CBCBlockCipher.newInstance(AESEngine.newInstance()), new PKCS7Padding());
    cipher.init(encrypt, new ParametersWithIV(new KeyParameter(key), iv));
    return cipher;
  }
}
