package org.m2mrsp.protocol.exception;

/**
 * Raised when a CMAC or HMAC does not match, including missing MACs and replayed counters.
 */
public class MacVerificationFailedException extends RspException {

  public MacVerificationFailedException(String message) {
    super(ErrorKind.MAC_VERIFICATION_FAILED, message);
  }

  public MacVerificationFailedException(String message, Throwable cause) {
    super(ErrorKind.MAC_VERIFICATION_FAILED, message, cause);
  }
}
