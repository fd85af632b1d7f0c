package org.m2mrsp.protocol.model;

import java.util.List;

/**
 * Profile bound to one key establishment session: the canonical profile image split into
 * segments, each wrapped in an SCP03t INSTALL APDU.
 *
 * @param sessionId SM-DP session the package is bound to
 * @param isdpAid   target ISD-P
 * @param iccid     profile ICCID
 * @param segments  ordered segments
 */
public record BoundProfilePackage(String sessionId,
                                  String isdpAid,
                                  String iccid,
                                  List<ProfileSegment> segments) {
}
