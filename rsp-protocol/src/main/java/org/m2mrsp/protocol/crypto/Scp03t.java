package org.m2mrsp.protocol.crypto;

import static org.m2mrsp.protocol.crypto.RspCrypto.concat;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.bouncycastle.crypto.BufferedBlockCipher;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.AESEngine;
import org.bouncycastle.crypto.macs.CMac;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.m2mrsp.protocol.exception.DecryptionFailedException;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.model.SessionKeys;

/**
 * SCP03t secure channel codec: session key derivation, command encryption, C-MAC and APDU
 * framing. All operations are static and stateless; see {@link Scp03tChannel} for the counter
 * handling of a live channel.
 */
public final class Scp03t {

  public static final int SESSION_KEY_LENGTH = 16;
  public static final int MAC_LENGTH = 8;
  public static final int BLOCK_SIZE = 16;

  public static final int CLA_GP = 0x80;
  public static final int INS_INSTALL = 0xE6;
  public static final int P1_FOR_LOAD = 0x02;
  public static final int P2_NONE = 0x00;

  private static final byte[] ZERO_ICV = new byte[BLOCK_SIZE];

  private Scp03t() {
  }

  // ── Keys ─────────────────────────────────────────────────────────────────

  /**
   * Derives S-ENC, S-MAC and S-RMAC. The context binds both challenges and both identities:
   * {@code hostChallenge || cardChallenge || hostId || cardId}.
   */
  public static SessionKeys deriveSessionKeys(byte[] sharedSecret, String hostId, String cardId,
                                              byte[] hostChallenge, byte[] cardChallenge) {
    byte[] context = concat(hostChallenge, cardChallenge,
        hostId.getBytes(StandardCharsets.UTF_8), cardId.getBytes(StandardCharsets.UTF_8));
    return new SessionKeys(
        NistKdf.deriveKey(sharedSecret, SESSION_KEY_LENGTH, "s_enc", context),
        NistKdf.deriveKey(sharedSecret, SESSION_KEY_LENGTH, "s_mac", context),
        NistKdf.deriveKey(sharedSecret, SESSION_KEY_LENGTH, "s_rmac", context));
  }

  // ── Encryption ───────────────────────────────────────────────────────────

  public static byte[] encryptCommand(byte[] data, byte[] sEnc) {
    return encryptCommand(data, sEnc, ZERO_ICV);
  }

  /**
   * AES-CBC with PKCS#7 padding.
   */
  public static byte[] encryptCommand(byte[] data, byte[] sEnc, byte[] icv) {
    BufferedBlockCipher cipher = cbc(true, sEnc, icv);
    byte[] out = new byte[cipher.getOutputSize(data.length)];
    int len = cipher.processBytes(data, 0, data.length, out, 0);
    try {
      len += cipher.doFinal(out, len);
    } catch (InvalidCipherTextException e) {
      throw new IllegalStateException("Padding failed while encrypting", e);
    }
    return Arrays.copyOf(out, len);
  }

  public static byte[] decryptResponse(byte[] data, byte[] sEnc) {
    return decryptResponse(data, sEnc, ZERO_ICV);
  }

  /**
   * Inverse of {@link #encryptCommand(byte[], byte[], byte[])}.
   *
   * @throws DecryptionFailedException on a bad length or padding
   */
  public static byte[] decryptResponse(byte[] data, byte[] sEnc, byte[] icv) {
    if (data.length == 0 || data.length % BLOCK_SIZE != 0) {
      throw new DecryptionFailedException("Ciphertext length " + data.length
          + " is not a positive multiple of " + BLOCK_SIZE);
    }
    BufferedBlockCipher cipher = cbc(false, sEnc, icv);
    byte[] out = new byte[cipher.getOutputSize(data.length)];
    try {
      int len = cipher.processBytes(data, 0, data.length, out, 0);
      len += cipher.doFinal(out, len);
      return Arrays.copyOf(out, len);
    } catch (InvalidCipherTextException | DataLengthException e) {
      throw new DecryptionFailedException("SCP03t decryption failed", e);
    }
  }

  private static BufferedBlockCipher cbc(boolean encrypt, byte[] key, byte[] icv) {
    PaddedBufferedBlockCipher cipher = new PaddedBufferedBlockCipher(
        CBCBlockCipher.newInstance(AESEngine.newInstance()), new PKCS7Padding());
    cipher.init(encrypt, new ParametersWithIV(new KeyParameter(key), icv));
    return cipher;
  }

  // ── MAC ──────────────────────────────────────────────────────────────────

  /**
   * AES-CMAC over {@code counter || data} (or {@code data} when counter is null), truncated to
   * 8 bytes.
   */
  public static byte[] calculateMac(byte[] data, byte[] sMac, byte[] counter) {
    CMac cmac = new CMac(AESEngine.newInstance(), MAC_LENGTH * 8);
    cmac.init(new KeyParameter(sMac));
    if (counter != null) {
      cmac.update(counter, 0, counter.length);
    }
    cmac.update(data, 0, data.length);
    byte[] mac = new byte[MAC_LENGTH];
    cmac.doFinal(mac, 0);
    return mac;
  }

  /**
   * @throws MacVerificationFailedException if {@code mac} does not match
   */
  public static void verifyMac(byte[] data, byte[] mac, byte[] sMac, byte[] counter) {
    if (!RspCrypto.constantTimeEquals(calculateMac(data, sMac, counter), mac)) {
      throw new MacVerificationFailedException("SCP03t C-MAC mismatch");
    }
  }

  // ── APDU framing ─────────────────────────────────────────────────────────

  /**
   * Formats a command APDU (ISO 7816-4 cases 1 to 4).
   * <ul>
   *   <li>Lc is one byte, or {@code 00 hi lo} when the data exceeds 255 bytes.</li>
   *   <li>Le is {@code expected % 256} (so 256 encodes as {@code 00}), or {@code 00 hi lo}
   *       when more than 256 bytes are expected.</li>
   * </ul>
   *
   * @param data           command data, null or empty for none
   * @param expectedLength expected response length, 0 for none
   */
  public static byte[] formatApdu(int cla, int ins, int p1, int p2, byte[] data,
                                  int expectedLength) {
    if (data != null && data.length > 0xFFFF) {
      throw new IllegalArgumentException("APDU data too long: " + data.length);
    }
    if (expectedLength < 0 || expectedLength > 0xFFFF) {
      throw new IllegalArgumentException("Invalid expected length: " + expectedLength);
    }
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.write(cla);
    out.write(ins);
    out.write(p1);
    out.write(p2);
    if (data != null && data.length > 0) {
      if (data.length > 255) {
        out.write(0);
        out.write(data.length >> 8);
        out.write(data.length & 0xFF);
      } else {
        out.write(data.length);
      }
      out.writeBytes(data);
    }
    if (expectedLength > 0) {
      if (expectedLength > 256) {
        out.write(0);
        out.write(expectedLength >> 8);
        out.write(expectedLength & 0xFF);
      } else {
        out.write(expectedLength % 256);
      }
    }
    return out.toByteArray();
  }

  /**
   * Builds an INSTALL [for load] APDU: data field is
   * {@code aid || enc(data) || C-MAC(counter || aid || enc(data))}.
   *
   * @param keys    session keys
   * @param counter 4-byte command counter
   * @param isdpAid target ISD-P, hex
   * @param data    plaintext to protect
   */
  public static byte[] buildInstallApdu(SessionKeys keys, byte[] counter, String isdpAid,
                                        byte[] data) {
    byte[] body = concat(RspCrypto.fromHex(isdpAid), encryptCommand(data, keys.sEnc()));
    byte[] mac = calculateMac(body, keys.sMac(), counter);
    return formatApdu(CLA_GP, INS_INSTALL, P1_FOR_LOAD, P2_NONE, concat(body, mac), 0);
  }

  /**
   * Opens an APDU built by {@link #buildInstallApdu}. The MAC is checked before anything is
   * decrypted.
   *
   * @throws MacVerificationFailedException on a header, AID or MAC mismatch
   * @throws DecryptionFailedException      if the authenticated ciphertext fails to decrypt
   */
  public static byte[] openInstallApdu(byte[] apdu, SessionKeys keys, byte[] counter,
                                       String isdpAid) {
    byte[] aid = RspCrypto.fromHex(isdpAid);
    if (apdu.length < 5 || (apdu[0] & 0xFF) != CLA_GP || (apdu[1] & 0xFF) != INS_INSTALL
        || (apdu[2] & 0xFF) != P1_FOR_LOAD || (apdu[3] & 0xFF) != P2_NONE) {
      throw new MacVerificationFailedException("Not an INSTALL [for load] APDU");
    }
    int lc;
    int offset;
    if (apdu[4] == 0 && apdu.length >= 7) {
      lc = ((apdu[5] & 0xFF) << 8) | (apdu[6] & 0xFF);
      offset = 7;
    } else {
      lc = apdu[4] & 0xFF;
      offset = 5;
    }
    if (apdu.length != offset + lc || lc < aid.length + BLOCK_SIZE + MAC_LENGTH) {
      throw new MacVerificationFailedException("INSTALL APDU length mismatch");
    }
    byte[] field = Arrays.copyOfRange(apdu, offset, offset + lc);
    byte[] body = Arrays.copyOf(field, lc - MAC_LENGTH);
    byte[] mac = Arrays.copyOfRange(field, lc - MAC_LENGTH, lc);
    if (!RspCrypto.constantTimeEquals(Arrays.copyOf(body, aid.length), aid)) {
      throw new MacVerificationFailedException("INSTALL APDU addressed to a different ISD-P");
    }
    verifyMac(body, mac, keys.sMac(), counter);
    return decryptResponse(Arrays.copyOfRange(body, aid.length, body.length), keys.sEnc());
  }
}
