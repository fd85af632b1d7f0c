package org.m2mrsp.protocol.model;

/**
 * eUICC acknowledgement of a received segment.
 *
 * @param isdpAid  target ISD-P
 * @param index    acknowledged segment
 * @param complete true once the last segment was accepted and the profile installed
 */
public record SegmentAck(String isdpAid, int index, boolean complete) {
}
