package org.m2mrsp.protocol.identity;

import java.security.cert.X509Certificate;

/**
 * Decides whether a peer certificate is acceptable.
 * <p>
 * Implementations must be thread-safe and must fail closed.
 */
public interface CertificateVerifier {

  /**
   * Verifies a peer certificate.
   *
   * @param certificate the certificate presented by the peer
   * @throws org.m2mrsp.protocol.exception.CertificateVerificationFailedException if not trusted
   */
  void verify(X509Certificate certificate);
}
