package org.m2mrsp.protocol.identity;

import java.security.KeyPair;
import java.security.PublicKey;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Root certificate authority that issues the entity certificates. Its self-signed certificate
 * is the trust anchor every entity verifies peers against.
 */
public class CertificateAuthority {

  private static final Logger log = LoggerFactory.getLogger(CertificateAuthority.class);

  static final Duration CA_VALIDITY = Duration.ofDays(3650);
  static final Duration ENTITY_VALIDITY = Duration.ofDays(365);

  private final String name;
  private final KeyPair keyPair;
  private final X509Certificate certificate;

  private CertificateAuthority(String name, KeyPair keyPair, X509Certificate certificate) {
    this.name = name;
    this.keyPair = keyPair;
    this.certificate = certificate;
  }

  /**
   * Creates a new root with a fresh P-256 key pair and a 10-year self-signed certificate.
   *
   * @param name the CA common name
   * @return the authority
   */
  public static CertificateAuthority create(String name) {
    KeyPair keyPair = Certificates.generateKeyPair();
    Instant now = Instant.now();
    String dn = Certificates.distinguishedName(name);
    X509Certificate certificate = Certificates.create(dn, dn, keyPair.getPublic(),
        keyPair.getPrivate(), true, Date.from(now), Date.from(now.plus(CA_VALIDITY)));
    log.info("Created root CA {}", name);
    return new CertificateAuthority(name, keyPair, certificate);
  }

  /**
   * Issues a one-year end-entity certificate.
   *
   * @param commonName subject common name
   * @param publicKey  subject public key
   * @return the certificate
   */
  public X509Certificate issue(String commonName, PublicKey publicKey) {
    Instant now = Instant.now();
    log.debug("Issuing certificate for {}", commonName);
    return Certificates.create(Certificates.distinguishedName(commonName),
        Certificates.distinguishedName(name), publicKey, keyPair.getPrivate(), false,
        Date.from(now), Date.from(now.plus(ENTITY_VALIDITY)));
  }

  public String getName() {
    return name;
  }

  public X509Certificate getCertificate() {
    return certificate;
  }
}
