package org.m2mrsp.server.orchestrator;

import org.m2mrsp.protocol.model.DerivedKeySet;

/**
 * Outcome of the key establishment phase.
 *
 * @param sessionId  SM-DP session holding the secure channel
 * @param isdpAid    ISD-P the channel is bound to
 * @param smDpKeys   keys derived by SM-DP
 * @param euiccKeys  keys derived by the eUICC
 */
public record KeyEstablishmentResult(String sessionId,
                                     String isdpAid,
                                     DerivedKeySet smDpKeys,
                                     DerivedKeySet euiccKeys) {

  /**
   * Whether both sides hold the same key set.
   */
  public boolean keysMatch() {
    return smDpKeys.equals(euiccKeys);
  }
}
