package org.m2mrsp.protocol.exception;

/**
 * Raised when ciphertext cannot be decrypted (bad length or padding).
 */
public class DecryptionFailedException extends RspException {

  public DecryptionFailedException(String message) {
    super(ErrorKind.DECRYPTION_FAILED, message);
  }

  public DecryptionFailedException(String message, Throwable cause) {
    super(ErrorKind.DECRYPTION_FAILED, message, cause);
  }
}
