package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /smsr/isdp/create} response
 *
 * @param status  always {@code success}
 * @param isdpAid allocated AID
 * @param euiccId owning eUICC
 */
public record IsdpCreateResponse(@JsonProperty("status") String status,
                                 @JsonProperty("isdpAid") String isdpAid,
                                 @JsonProperty("euiccId") String euiccId) {

  public IsdpCreateResponse(String isdpAid, String euiccId) {
    this("success", isdpAid, euiccId);
  }
}
