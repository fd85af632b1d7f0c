package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Runs all provisioning phases for a configured eUICC.
 * <p>
 * Used by: {@code POST /provisioning/run}
 *
 * @param euiccId        target eUICC
 * @param memoryRequired ISD-P memory
 * @param profileType    profile type, {@code telecommunication} when absent
 * @param iccid          profile ICCID
 */
public record ProvisioningRequest(@JsonProperty("euiccId") String euiccId,
                                  @JsonProperty("memoryRequired") int memoryRequired,
                                  @JsonProperty("profileType") String profileType,
                                  @JsonProperty("iccid") String iccid) {
}
