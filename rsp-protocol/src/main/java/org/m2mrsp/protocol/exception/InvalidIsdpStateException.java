package org.m2mrsp.protocol.exception;

/**
 * Raised on an ISD-P lifecycle transition that is not allowed from the current state.
 */
public class InvalidIsdpStateException extends RspException {

  public InvalidIsdpStateException(String message) {
    super(ErrorKind.INVALID_ISDP_STATE, message);
  }

  public InvalidIsdpStateException(String message, Throwable cause) {
    super(ErrorKind.INVALID_ISDP_STATE, message, cause);
  }
}
