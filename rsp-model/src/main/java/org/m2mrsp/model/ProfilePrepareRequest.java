package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /smdp/profile/prepare}
 *
 * @param profileType profile type, {@code telecommunication} when absent
 * @param iccid       ICCID, 15 to 20 digits
 */
public record ProfilePrepareRequest(@JsonProperty("profileType") String profileType,
                                    @JsonProperty("iccid") String iccid) {
}
