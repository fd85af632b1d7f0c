package org.m2mrsp.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.List;

/**
 * The hashed body of a profile. Property order is fixed so the canonical JSON, and hence the
 * integrity hash, is identical on every side.
 */
@JsonPropertyOrder({"profileType", "iccid", "timestamp", "simData", "applications"})
public record ProfileContent(@JsonProperty("profileType") String profileType,
                             @JsonProperty("iccid") String iccid,
                             @JsonProperty("timestamp") long timestamp,
                             @JsonProperty("simData") SimData simData,
                             @JsonProperty("applications") List<ProfileApplication> applications) {
}
