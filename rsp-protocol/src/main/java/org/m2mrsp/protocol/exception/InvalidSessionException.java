package org.m2mrsp.protocol.exception;

/**
 * Raised when a session id is unknown, revoked, or used in the wrong step.
 */
public class InvalidSessionException extends RspException {

  public InvalidSessionException(String message) {
    super(ErrorKind.INVALID_SESSION, message);
  }

  protected InvalidSessionException(ErrorKind errorKind, String message) {
    super(errorKind, message);
  }
}
