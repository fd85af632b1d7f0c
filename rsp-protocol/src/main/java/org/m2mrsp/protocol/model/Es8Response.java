package org.m2mrsp.protocol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ES8 response body. Travels PSK-encrypted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Es8Response(@JsonProperty("status") String status,
                          @JsonProperty("command") Es8CommandType command,
                          @JsonProperty("isdpAid") String isdpAid,
                          @JsonProperty("iccid") String iccid,
                          @JsonProperty("profileStatus") ProfileStatus profileStatus) {

  public static final String SUCCESS = "success";
}
