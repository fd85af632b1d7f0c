package org.m2mrsp.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * Subscriber credentials carried by a profile.
 */
@JsonPropertyOrder({"imsi", "ki", "opc"})
public record SimData(@JsonProperty("imsi") String imsi,
                      @JsonProperty("ki") String ki,
                      @JsonProperty("opc") String opc) {

  @Override
  public String toString() {
    return "SimData[imsi=" + imsi + "]";
  }
}
