package org.m2mrsp.protocol.exception;

/**
 * Base type for every protocol failure. Unchecked, like the rest of the code base: callers that
 * can recover catch the specific subtype, everything else propagates to the transport layer.
 */
public class RspException extends RuntimeException {

  private final ErrorKind errorKind;

  /**
   * Instantiates a new Rsp exception.
   *
   * @param errorKind the error kind
   * @param message   the message
   */
  public RspException(ErrorKind errorKind, String message) {
    super(message);
    this.errorKind = errorKind;
  }

  /**
   * Instantiates a new Rsp exception.
   *
   * @param errorKind the error kind
   * @param message   the message
   * @param cause     the cause
   */
  public RspException(ErrorKind errorKind, String message, Throwable cause) {
    super(message, cause);
    this.errorKind = errorKind;
  }

  /**
   * Gets error kind.
   *
   * @return the error kind
   */
  public ErrorKind getErrorKind() {
    return errorKind;
  }
}
