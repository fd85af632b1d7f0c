package org.m2mrsp.protocol.model;

/**
 * One SCP03t-protected slice of a bound profile package.
 *
 * @param index 0-based segment index
 * @param total number of segments in the package
 * @param apdu  INSTALL APDU carrying the slice
 */
public record ProfileSegment(int index, int total, byte[] apdu) {
}
