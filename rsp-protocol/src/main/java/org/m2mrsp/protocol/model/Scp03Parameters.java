package org.m2mrsp.protocol.model;

/**
 * Key set references recorded with an ISD-P.
 */
public record Scp03Parameters(int keysetVersion, int keysetId, int initialKeyVersion,
                              int baseKeyIndex) {

  public static final Scp03Parameters DEFAULT = new Scp03Parameters(0x01, 0x01, 0x01, 0x01);
}
