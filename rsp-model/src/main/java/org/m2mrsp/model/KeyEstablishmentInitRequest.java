package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asks SM-DP to open a key establishment session with an eUICC.
 * <p>
 * Used by: {@code POST /smdp/key-establishment/init}
 *
 * @param euiccId target eUICC
 * @param isdpAid ISD-P the session keys will protect
 */
public record KeyEstablishmentInitRequest(@JsonProperty("euiccId") String euiccId,
                                          @JsonProperty("isdpAid") String isdpAid) {
}
