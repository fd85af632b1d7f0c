package org.m2mrsp.protocol.model;

import java.time.Instant;

/**
 * Immutable snapshot of one ISD-P. Transitions produce a new record.
 *
 * @param isdpAid         {@code A0000005591010} followed by 8 upper-case hex digits
 * @param euiccId         owning eUICC
 * @param memoryAllocated memory reserved at creation
 * @param state           lifecycle state
 * @param iccid           bound profile, null until installation
 * @param scp03           key set references
 * @param createdAt       creation time
 */
public record IsdpRecord(String isdpAid,
                         String euiccId,
                         int memoryAllocated,
                         IsdpState state,
                         String iccid,
                         Scp03Parameters scp03,
                         Instant createdAt) {

  public IsdpRecord withState(IsdpState newState) {
    return new IsdpRecord(isdpAid, euiccId, memoryAllocated, newState, iccid, scp03, createdAt);
  }

  public IsdpRecord withProfile(String boundIccid, IsdpState newState) {
    return new IsdpRecord(isdpAid, euiccId, memoryAllocated, newState, boundIccid, scp03, createdAt);
  }
}
