package org.m2mrsp.protocol.exception;

/**
 * Raised when an eUICC cannot fit a requested ISD-P.
 */
public class InsufficientMemoryException extends RspException {

  private final int requested;
  private final int available;

  public InsufficientMemoryException(int requested, int available) {
    super(ErrorKind.INSUFFICIENT_MEMORY, "Not enough memory");
    this.requested = requested;
    this.available = available;
  }

  public int getRequested() {
    return requested;
  }

  public int getAvailable() {
    return available;
  }
}
