package org.m2mrsp.protocol.identity;

import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;
import java.util.List;
import org.m2mrsp.protocol.exception.CertificateVerificationFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accepts certificates issued directly by one of a fixed set of trusted roots.
 *
 * <p>Checks performed:
 * <ol>
 *   <li>The certificate is inside its validity window.</li>
 *   <li>An anchor's subject equals the certificate's issuer.</li>
 *   <li>The anchor is itself inside its validity window.</li>
 *   <li>The certificate signature verifies under the anchor's public key.</li>
 * </ol>
 */
public class TrustAnchorCertificateVerifier implements CertificateVerifier {

  private static final Logger log = LoggerFactory.getLogger(TrustAnchorCertificateVerifier.class);

  private final List<X509Certificate> anchors;

  public TrustAnchorCertificateVerifier(List<X509Certificate> anchors) {
    if (anchors.isEmpty()) {
      throw new IllegalArgumentException("At least one trust anchor is required");
    }
    this.anchors = List.copyOf(anchors);
  }

  public TrustAnchorCertificateVerifier(CertificateAuthority authority) {
    this(List.of(authority.getCertificate()));
  }

  @Override
  public void verify(X509Certificate certificate) {
    if (certificate == null) {
      throw new CertificateVerificationFailedException("No certificate presented");
    }
    try {
      certificate.checkValidity();
    } catch (GeneralSecurityException e) {
      throw new CertificateVerificationFailedException("Certificate outside its validity window", e);
    }
    for (X509Certificate anchor : anchors) {
      if (!anchor.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())) {
        continue;
      }
      try {
        anchor.checkValidity();
        certificate.verify(anchor.getPublicKey(), Certificates.PROVIDER);
        log.debug("Verified certificate {}", certificate.getSubjectX500Principal().getName());
        return;
      } catch (GeneralSecurityException e) {
        throw new CertificateVerificationFailedException(
            "Certificate not signed by trusted root " + anchor.getSubjectX500Principal().getName(), e);
      }
    }
    throw new CertificateVerificationFailedException(
        "No trusted root for issuer " + certificate.getIssuerX500Principal().getName());
  }
}
