package org.m2mrsp.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;

/**
 * One simulated eUICC.
 */
public class EuiccConfiguration {

  @NotEmpty
  private String euiccId;

  /**
   * Memory available for ISD-Ps, in bytes.
   */
  @Min(1)
  private int freeMemory = 1024;

  @JsonProperty
  public String getEuiccId() {
    return euiccId;
  }

  @JsonProperty
  public void setEuiccId(String euiccId) {
    this.euiccId = euiccId;
  }

  @JsonProperty
  public int getFreeMemory() {
    return freeMemory;
  }

  @JsonProperty
  public void setFreeMemory(int freeMemory) {
    this.freeMemory = freeMemory;
  }
}
