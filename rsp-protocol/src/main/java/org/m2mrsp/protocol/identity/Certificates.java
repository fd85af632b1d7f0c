package org.m2mrsp.protocol.identity;

import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Provider;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.util.Date;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.m2mrsp.protocol.exception.CertificateVerificationFailedException;

/**
 * X.509 and key pair plumbing shared by {@link EntityIdentity} and
 * {@link CertificateAuthority}. Uses a private BouncyCastle provider instance rather than
 * registering one globally.
 */
public final class Certificates {

  static final Provider PROVIDER = new BouncyCastleProvider();
  static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

  private static final SecureRandom RANDOM = new SecureRandom();

  private Certificates() {
  }

  static KeyPair generateKeyPair() {
    try {
      KeyPairGenerator generator = KeyPairGenerator.getInstance("EC", PROVIDER);
      generator.initialize(new ECGenParameterSpec("secp256r1"), RANDOM);
      return generator.generateKeyPair();
    } catch (GeneralSecurityException e) {
      throw new IllegalStateException("P-256 key generation unavailable", e);
    }
  }

  static X509Certificate create(String subject,
                                String issuer,
                                PublicKey subjectPublicKey,
                                PrivateKey signingKey,
                                boolean isCa,
                                Date notBefore,
                                Date notAfter) {
    JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        new X500Name(issuer),
        new BigInteger(160, RANDOM),
        notBefore,
        notAfter,
        new X500Name(subject),
        subjectPublicKey);
    try {
      builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(isCa));
      if (isCa) {
        builder.addExtension(Extension.keyUsage, true,
            new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign));
      } else {
        builder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature));
      }
      X509CertificateHolder holder = builder.build(
          new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).setProvider(PROVIDER).build(signingKey));
      return new JcaX509CertificateConverter().setProvider(PROVIDER).getCertificate(holder);
    } catch (CertIOException | OperatorCreationException | CertificateException e) {
      throw new IllegalStateException("Unable to issue certificate for " + subject, e);
    }
  }

  /**
   * DER encoding of a certificate.
   */
  public static byte[] encode(X509Certificate certificate) {
    try {
      return certificate.getEncoded();
    } catch (CertificateEncodingException e) {
      throw new IllegalStateException("Unable to encode certificate", e);
    }
  }

  /**
   * Parses a DER certificate received from a peer.
   *
   * @throws CertificateVerificationFailedException if the bytes are not a certificate
   */
  public static X509Certificate decode(byte[] der) {
    try {
      CertificateFactory factory = CertificateFactory.getInstance("X.509", PROVIDER);
      return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
    } catch (CertificateException | RuntimeException e) {
      throw new CertificateVerificationFailedException("Malformed certificate", e);
    }
  }

  /**
   * Common name of the certificate subject.
   *
   * @throws CertificateVerificationFailedException if the subject has no CN
   */
  public static String commonName(X509Certificate certificate) {
    RDN[] rdns = X500Name.getInstance(certificate.getSubjectX500Principal().getEncoded())
        .getRDNs(BCStyle.CN);
    if (rdns.length == 0) {
      throw new CertificateVerificationFailedException("Certificate subject has no common name");
    }
    return IETFUtils.valueToString(rdns[0].getFirst().getValue());
  }

  static String distinguishedName(String commonName) {
    return "CN=" + commonName + ",O=M2M RSP";
  }
}
