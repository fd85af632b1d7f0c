package org.m2mrsp.protocol.exception;

/**
 * Raised when a key has a length the cipher does not accept.
 */
public class InvalidKeyLengthException extends RspException {

  public InvalidKeyLengthException(String message) {
    super(ErrorKind.INVALID_KEY_LENGTH, message);
  }

  public InvalidKeyLengthException(String message, Throwable cause) {
    super(ErrorKind.INVALID_KEY_LENGTH, message, cause);
  }
}
