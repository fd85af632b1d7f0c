package org.m2mrsp.protocol.exception;

/**
 * Raised when a session existed but outlived its time-to-live.
 */
public class SessionExpiredException extends InvalidSessionException {

  public SessionExpiredException(String message) {
    super(ErrorKind.SESSION_EXPIRED, message);
  }
}
