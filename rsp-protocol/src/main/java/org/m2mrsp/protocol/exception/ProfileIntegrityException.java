package org.m2mrsp.protocol.exception;

/**
 * Raised when a reassembled profile does not match the hash computed at preparation.
 */
public class ProfileIntegrityException extends RspException {

  public ProfileIntegrityException(String message) {
    super(ErrorKind.PROFILE_INTEGRITY_FAILED, message);
  }

  public ProfileIntegrityException(String message, Throwable cause) {
    super(ErrorKind.PROFILE_INTEGRITY_FAILED, message, cause);
  }
}
