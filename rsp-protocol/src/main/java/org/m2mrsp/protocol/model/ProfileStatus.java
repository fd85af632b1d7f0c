package org.m2mrsp.protocol.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a profile as it moves from SM-DP to the eUICC.
 */
public enum ProfileStatus {
  PREPARED("prepared"),
  TRANSMITTED("transmitted"),
  INSTALLED("installed"),
  ENABLED("enabled"),
  DISABLED("disabled");

  private final String value;

  ProfileStatus(String value) {
    this.value = value;
  }

  /**
   * Wire value.
   *
   * @return the lower-case status name
   */
  @JsonValue
  public String value() {
    return value;
  }
}
