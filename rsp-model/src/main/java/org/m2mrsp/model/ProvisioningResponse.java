package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Map;

/**
 * Outcome of a provisioning run.
 *
 * @param status        always {@code success}
 * @param euiccId       provisioned eUICC
 * @param isdpAid       ISD-P holding the profile
 * @param sessionId     key establishment session
 * @param iccid         installed profile
 * @param integrityHash profile hash
 * @param profileStatus final profile status
 * @param phaseMillis   phase durations in milliseconds, by lower-case phase name
 */
public record ProvisioningResponse(@JsonProperty("status") String status,
                                   @JsonProperty("euiccId") String euiccId,
                                   @JsonProperty("isdpAid") String isdpAid,
                                   @JsonProperty("sessionId") String sessionId,
                                   @JsonProperty("iccid") String iccid,
                                   @JsonProperty("integrityHash") String integrityHash,
                                   @JsonProperty("profileStatus") String profileStatus,
                                   @JsonProperty("phaseMillis") Map<String, Long> phaseMillis) {
}
