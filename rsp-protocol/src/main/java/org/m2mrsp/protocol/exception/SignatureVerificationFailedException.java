package org.m2mrsp.protocol.exception;

/**
 * Raised when an ECDSA signature over handshake material does not verify.
 */
public class SignatureVerificationFailedException extends RspException {

  public SignatureVerificationFailedException(String message) {
    super(ErrorKind.SIGNATURE_VERIFICATION_FAILED, message);
  }

  public SignatureVerificationFailedException(String message, Throwable cause) {
    super(ErrorKind.SIGNATURE_VERIFICATION_FAILED, message, cause);
  }
}
