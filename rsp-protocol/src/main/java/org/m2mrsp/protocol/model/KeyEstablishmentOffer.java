package org.m2mrsp.protocol.model;

import java.security.cert.X509Certificate;

/**
 * First key establishment message, sent by SM-DP.
 *
 * @param sessionId       SM-DP session identifier
 * @param isdpAid         target ISD-P
 * @param publicKey       SM-DP ephemeral public key
 * @param randomChallenge 16-byte challenge
 * @param signature       ECDSA over publicKey || randomChallenge || isdpAid
 * @param certificate     SM-DP certificate
 */
public record KeyEstablishmentOffer(String sessionId,
                                    String isdpAid,
                                    byte[] publicKey,
                                    byte[] randomChallenge,
                                    byte[] signature,
                                    X509Certificate certificate) {
}
