package org.m2mrsp.protocol.model;

import java.security.cert.X509Certificate;

/**
 * eUICC answer to a {@link PskRekeyOffer}. The new PSK stays pending on the eUICC until SM-SR
 * confirms it.
 *
 * @param sessionId   SM-SR session
 * @param publicKey   eUICC ephemeral public key
 * @param signature   eUICC signature over publicKey || challenge || euiccId
 * @param certificate eUICC certificate
 */
public record PskRekeyResponse(String sessionId,
                               byte[] publicKey,
                               byte[] signature,
                               X509Certificate certificate) {
}
