package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.m2mrsp.protocol.model.Profile;

/**
 * Summary of a prepared profile. SIM secrets are not echoed.
 *
 * @param status        always {@code success}
 * @param iccid         profile ICCID
 * @param profileType   profile type
 * @param integrityHash SHA-256 of the canonical content
 * @param profileStatus {@code prepared}
 */
public record ProfilePrepareResponse(@JsonProperty("status") String status,
                                     @JsonProperty("iccid") String iccid,
                                     @JsonProperty("profileType") String profileType,
                                     @JsonProperty("integrityHash") String integrityHash,
                                     @JsonProperty("profileStatus") String profileStatus) {

  public ProfilePrepareResponse(Profile profile) {
    this("success", profile.iccid(), profile.content().profileType(), profile.integrityHash(),
        profile.status().value());
  }
}
