package org.m2mrsp.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Uniform failure body: {@code {status:"error", message}}.
 *
 * @param status  always {@code error}
 * @param message human readable reason
 */
public record ErrorResponse(@JsonProperty("status") String status,
                            @JsonProperty("message") String message) {

  public static final String ERROR = "error";

  public ErrorResponse(String message) {
    this(ERROR, message);
  }
}
