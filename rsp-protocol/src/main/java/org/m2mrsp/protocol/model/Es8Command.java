package org.m2mrsp.protocol.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ES8 command body. Travels PSK-encrypted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Es8Command(@JsonProperty("command") Es8CommandType command,
                         @JsonProperty("isdpAid") String isdpAid,
                         @JsonProperty("memory") Integer memory,
                         @JsonProperty("iccid") String iccid,
                         @JsonProperty("timestamp") long timestamp) {
}
