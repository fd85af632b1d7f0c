package org.m2mrsp.protocol.exception;

/**
 * Raised when an operation names an eUICC that was never registered.
 */
public class EuiccNotRegisteredException extends RspException {

  public EuiccNotRegisteredException(String message) {
    super(ErrorKind.EUICC_NOT_REGISTERED, message);
  }

  public EuiccNotRegisteredException(String message, Throwable cause) {
    super(ErrorKind.EUICC_NOT_REGISTERED, message, cause);
  }
}
