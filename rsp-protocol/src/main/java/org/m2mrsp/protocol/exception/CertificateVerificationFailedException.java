package org.m2mrsp.protocol.exception;

/**
 * Raised when a peer certificate is expired, malformed or not issued by a trusted root.
 */
public class CertificateVerificationFailedException extends RspException {

  public CertificateVerificationFailedException(String message) {
    super(ErrorKind.CERTIFICATE_VERIFICATION_FAILED, message);
  }

  public CertificateVerificationFailedException(String message, Throwable cause) {
    super(ErrorKind.CERTIFICATE_VERIFICATION_FAILED, message, cause);
  }
}
