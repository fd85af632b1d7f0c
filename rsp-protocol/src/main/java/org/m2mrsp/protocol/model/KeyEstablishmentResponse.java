package org.m2mrsp.protocol.model;

import java.security.cert.X509Certificate;

/**
 * Second key establishment message, sent by the eUICC.
 *
 * @param sessionId     SM-DP session identifier being answered
 * @param publicKey     eUICC ephemeral public key
 * @param cardChallenge 16-byte challenge used for SCP03t session keys
 * @param receipt       key confirmation
 * @param certificate   eUICC certificate
 */
public record KeyEstablishmentResponse(String sessionId,
                                       byte[] publicKey,
                                       byte[] cardChallenge,
                                       KeyEstablishmentReceipt receipt,
                                       X509Certificate certificate) {
}
