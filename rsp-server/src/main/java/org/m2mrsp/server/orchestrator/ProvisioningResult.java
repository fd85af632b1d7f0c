package org.m2mrsp.server.orchestrator;

import java.time.Duration;
import java.util.Map;
import org.m2mrsp.protocol.model.DerivedKeySet;
import org.m2mrsp.protocol.model.ProfileStatus;

/**
 * Outcome of a complete provisioning run.
 *
 * @param euiccId       provisioned eUICC
 * @param isdpAid       ISD-P holding the profile
 * @param sessionId     key establishment session
 * @param iccid         installed profile
 * @param integrityHash profile hash computed at preparation
 * @param keys          key set both sides derived
 * @param profileStatus final profile status on the eUICC
 * @param timings       duration of each phase, in execution order
 */
public record ProvisioningResult(String euiccId,
                                 String isdpAid,
                                 String sessionId,
                                 String iccid,
                                 String integrityHash,
                                 DerivedKeySet keys,
                                 ProfileStatus profileStatus,
                                 Map<ProtocolPhase, Duration> timings) {

  public Duration totalDuration() {
    return timings.values().stream().reduce(Duration.ZERO, Duration::plus);
  }
}
