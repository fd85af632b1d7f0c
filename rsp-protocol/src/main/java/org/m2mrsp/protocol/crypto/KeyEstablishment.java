package org.m2mrsp.protocol.crypto;

import java.nio.charset.StandardCharsets;

/**
 * Byte layouts signed and MACed during authenticated key establishment.
 */
public final class KeyEstablishment {

  private static final byte[] RECEIPT_LABEL = "receipt".getBytes(StandardCharsets.US_ASCII);
  private static final byte[] PSK_CONFIRM_LABEL = "psk_confirm".getBytes(StandardCharsets.US_ASCII);

  public static final String PSK_KEY_TYPE = "psk_tls";
  public static final int ESTABLISHED_PSK_LENGTH = 32;

  private KeyEstablishment() {
  }

  /**
   * Data the initiator signs: {@code publicKey || challenge || target}.
   */
  public static byte[] offerData(byte[] publicKey, byte[] challenge, String target) {
    return RspCrypto.concat(publicKey, challenge, target.getBytes(StandardCharsets.US_ASCII));
  }

  /**
   * Key confirmation MAC:
   * {@code HMAC(Km, "receipt" || hostChallenge || cardChallenge || cardKey || hostKey)}.
   */
  public static byte[] receiptMac(byte[] km, byte[] hostChallenge, byte[] cardChallenge,
                                  byte[] cardPublicKey, byte[] hostPublicKey) {
    return RspCrypto.hmacSha256(km, RECEIPT_LABEL, hostChallenge, cardChallenge, cardPublicKey,
        hostPublicKey);
  }

  /**
   * Transport PSK established over ECDH between SM-SR and an eUICC.
   */
  public static byte[] establishedPsk(byte[] sharedSecret, byte[] challenge, String euiccId) {
    return NistKdf.deriveKey(sharedSecret, ESTABLISHED_PSK_LENGTH, PSK_KEY_TYPE,
        RspCrypto.concat(challenge, euiccId.getBytes(StandardCharsets.US_ASCII)));
  }

  /**
   * Proof that the sender holds the newly established PSK.
   */
  public static byte[] pskConfirmation(byte[] psk, String sessionId) {
    return RspCrypto.hmacSha256(psk, PSK_CONFIRM_LABEL,
        sessionId.getBytes(StandardCharsets.US_ASCII));
  }
}
