package org.m2mrsp.server.orchestrator;

import org.m2mrsp.protocol.exception.RspException;

/**
 * Raised when a protocol phase fails. Carries the failing phase and the error kind of the
 * originating exception, which stays available as the cause.
 */
public class ProtocolAbortedException extends RspException {

  private final ProtocolPhase phase;

  public ProtocolAbortedException(ProtocolPhase phase, RspException cause) {
    super(cause.getErrorKind(), "Protocol aborted in " + phase + ": " + cause.getMessage(), cause);
    this.phase = phase;
  }

  public ProtocolPhase getPhase() {
    return phase;
  }

  @Override
  public synchronized RspException getCause() {
    return (RspException) super.getCause();
  }
}
