package org.m2mrsp.protocol.identity;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Date;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Long-term identity of an entity (SM-DP, SM-SR or eUICC): a P-256 key pair and the X.509
 * certificate binding it to the entity name. Immutable once created.
 */
public class EntityIdentity {

  private static final Logger log = LoggerFactory.getLogger(EntityIdentity.class);

  private final String name;
  private final KeyPair keyPair;
  private final X509Certificate certificate;

  private EntityIdentity(String name, KeyPair keyPair, X509Certificate certificate) {
    this.name = name;
    this.keyPair = keyPair;
    this.certificate = certificate;
  }

  /**
   * Creates an identity with a self-signed certificate valid for one year.
   */
  public static EntityIdentity selfSigned(String name) {
    KeyPair keyPair = Certificates.generateKeyPair();
    Instant now = Instant.now();
    String dn = Certificates.distinguishedName(name);
    X509Certificate certificate = Certificates.create(dn, dn, keyPair.getPublic(),
        keyPair.getPrivate(), false, Date.from(now),
        Date.from(now.plus(CertificateAuthority.ENTITY_VALIDITY)));
    log.debug("Created self-signed identity for {}", name);
    return new EntityIdentity(name, keyPair, certificate);
  }

  /**
   * Creates an identity whose certificate is issued by {@code authority}.
   */
  public static EntityIdentity issuedBy(String name, CertificateAuthority authority) {
    KeyPair keyPair = Certificates.generateKeyPair();
    X509Certificate certificate = authority.issue(name, keyPair.getPublic());
    log.debug("Created identity for {} issued by {}", name, authority.getName());
    return new EntityIdentity(name, keyPair, certificate);
  }

  /**
   * ECDSA-SHA256 signature over {@code data} in DER form.
   */
  public byte[] sign(byte[] data) {
    try {
      Signature signature = Signature.getInstance(Certificates.SIGNATURE_ALGORITHM,
          Certificates.PROVIDER);
      signature.initSign(keyPair.getPrivate());
      signature.update(data);
      return signature.sign();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("Signing failed for " + name, e);
    }
  }

  /**
   * Verifies an ECDSA-SHA256 signature. Fails closed: any parsing or provider error yields
   * {@code false}.
   */
  public static boolean verify(byte[] signature, byte[] data, PublicKey publicKey) {
    if (signature == null || data == null || publicKey == null) {
      return false;
    }
    try {
      Signature verifier = Signature.getInstance(Certificates.SIGNATURE_ALGORITHM,
          Certificates.PROVIDER);
      verifier.initVerify(publicKey);
      verifier.update(data);
      return verifier.verify(signature);
    } catch (GeneralSecurityException | RuntimeException e) {
      log.debug("Signature verification error: {}", e.getMessage());
      return false;
    }
  }

  public String getName() {
    return name;
  }

  public PublicKey getPublicKey() {
    return keyPair.getPublic();
  }

  public X509Certificate getCertificate() {
    return certificate;
  }
}
