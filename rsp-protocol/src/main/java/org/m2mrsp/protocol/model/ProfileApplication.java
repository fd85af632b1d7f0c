package org.m2mrsp.protocol.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An application installed with a profile (USIM, ISIM).
 */
@JsonPropertyOrder({"aid", "name", "priority"})
public record ProfileApplication(@JsonProperty("aid") String aid,
                                 @JsonProperty("name") String name,
                                 @JsonProperty("priority") int priority) {

  public static final ProfileApplication USIM = new ProfileApplication("A0000000871002", "USIM", 1);
  public static final ProfileApplication ISIM = new ProfileApplication("A0000000871004", "ISIM", 2);
}
