package org.m2mrsp.protocol.profile;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.m2mrsp.protocol.model.ProfileContent;

/**
 * The bytes carried inside a bound profile package: the profile content together with the
 * hash SM-DP computed at preparation.
 */
@JsonPropertyOrder({"profile", "hash"})
public record ProfileImage(@JsonProperty("profile") ProfileContent profile,
                           @JsonProperty("hash") String hash) {
}
