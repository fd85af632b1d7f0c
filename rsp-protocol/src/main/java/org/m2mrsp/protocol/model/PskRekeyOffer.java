package org.m2mrsp.protocol.model;

import java.security.cert.X509Certificate;

/**
 * SM-SR offer to replace an eUICC's transport PSK through ECDH.
 *
 * @param sessionId   SM-SR session
 * @param euiccId     target eUICC
 * @param publicKey   SM-SR ephemeral public key
 * @param challenge   16-byte challenge
 * @param signature   SM-SR signature over publicKey || challenge || euiccId
 * @param certificate SM-SR certificate
 */
public record PskRekeyOffer(String sessionId,
                            String euiccId,
                            byte[] publicKey,
                            byte[] challenge,
                            byte[] signature,
                            X509Certificate certificate) {
}
