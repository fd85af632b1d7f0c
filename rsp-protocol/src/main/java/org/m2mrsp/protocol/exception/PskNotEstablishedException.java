package org.m2mrsp.protocol.exception;

/**
 * Raised when an eUICC has no live pre-shared key.
 */
public class PskNotEstablishedException extends RspException {

  public PskNotEstablishedException(String message) {
    super(ErrorKind.PSK_NOT_ESTABLISHED, message);
  }

  public PskNotEstablishedException(String message, Throwable cause) {
    super(ErrorKind.PSK_NOT_ESTABLISHED, message, cause);
  }
}
