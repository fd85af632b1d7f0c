package org.m2mrsp.protocol.model;

/**
 * Output of the PSK transport cipher.
 *
 * @param iv      16-byte random IV, also the PBKDF2 salt
 * @param data    AES-CBC ciphertext
 * @param mac     HMAC-SHA256 over iv || data
 * @param keyType {@code AES-128} or {@code AES-256}, following the PSK length
 */
public record PskEnvelope(byte[] iv, byte[] data, byte[] mac, String keyType) {
}
