package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Confirms that SM-DP accepted the receipt. Keys never leave the entity.
 *
 * @param status    always {@code success}
 * @param sessionId the completed session
 */
public record KeyEstablishmentCompleteResponse(@JsonProperty("status") String status,
                                               @JsonProperty("session_id") String sessionId) {

  public KeyEstablishmentCompleteResponse(String sessionId) {
    this("success", sessionId);
  }
}
