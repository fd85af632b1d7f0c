package org.m2mrsp.protocol.model;

/**
 * A profile segment as delivered by SM-SR: the INSTALL APDU under the eUICC's PSK.
 */
public record PskSegment(String isdpAid, int index, int total, PskEnvelope envelope) {
}
