package org.m2mrsp.protocol.exception;

/**
 * Raised when a peer public key is not a valid uncompressed P-256 point.
 */
public class InvalidPublicKeyException extends RspException {

  public InvalidPublicKeyException(String message) {
    super(ErrorKind.INVALID_PUBLIC_KEY, message);
  }

  public InvalidPublicKeyException(String message, Throwable cause) {
    super(ErrorKind.INVALID_PUBLIC_KEY, message, cause);
  }
}
