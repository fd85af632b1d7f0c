package org.m2mrsp.protocol.exception;

/**
 * Raised when a profile or its binding to an ISD-P cannot be found.
 */
public class ProfileNotFoundException extends RspException {

  public ProfileNotFoundException(String message) {
    super(ErrorKind.PROFILE_NOT_FOUND, message);
  }

  public ProfileNotFoundException(String message, Throwable cause) {
    super(ErrorKind.PROFILE_NOT_FOUND, message, cause);
  }
}
