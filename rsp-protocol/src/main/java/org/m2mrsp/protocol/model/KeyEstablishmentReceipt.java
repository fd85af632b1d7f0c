package org.m2mrsp.protocol.model;

/**
 * Key confirmation produced by the eUICC.
 *
 * @param mac       HMAC-SHA256(Km, "receipt" || challenge || eUICC key || SM-DP key)
 * @param signature eUICC signature over {@code mac}
 */
public record KeyEstablishmentReceipt(byte[] mac, byte[] signature) {
}
