package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /smsr/isdp/create}
 *
 * @param euiccId        owning eUICC
 * @param memoryRequired memory to reserve
 */
public record IsdpCreateRequest(@JsonProperty("euiccId") String euiccId,
                                @JsonProperty("memoryRequired") int memoryRequired) {
}
