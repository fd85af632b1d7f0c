package org.m2mrsp.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import java.security.cert.X509Certificate;
import org.m2mrsp.protocol.exception.CertificateVerificationFailedException;
import org.m2mrsp.protocol.identity.CertificateVerifier;
import org.m2mrsp.protocol.identity.EntityIdentity;

/**
 * Health check that verifies an entity's certificate is within its validity period and chains
 * to the configured trust anchor.
 */
public class EntityCertificateHealthCheck extends HealthCheck {

  private final EntityIdentity identity;
  private final CertificateVerifier verifier;

  public EntityCertificateHealthCheck(EntityIdentity identity, CertificateVerifier verifier) {
    this.identity = identity;
    this.verifier = verifier;
  }

  @Override
  protected Result check() {
    X509Certificate certificate = identity.getCertificate();
    if (certificate == null) {
      return Result.unhealthy("%s has no certificate", identity.getName());
    }
    try {
      verifier.verify(certificate);
    } catch (CertificateVerificationFailedException e) {
      return Result.unhealthy("%s certificate is not trusted: %s", identity.getName(), e.getMessage());
    }
    return Result.healthy("subject=%s notAfter=%s", certificate.getSubjectX500Principal().getName(),
        certificate.getNotAfter().toInstant());
  }
}
