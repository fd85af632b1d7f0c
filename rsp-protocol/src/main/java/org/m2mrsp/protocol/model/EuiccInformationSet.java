package org.m2mrsp.protocol.model;

import java.security.cert.X509Certificate;

/**
 * eUICC information set (EIS) registered with SM-SR.
 *
 * @param euiccId      eUICC identifier
 * @param eid          {@code 89} followed by the eUICC identifier
 * @param svn          specification version number
 * @param freeMemory   free memory available for ISD-Ps
 * @param capabilities advertised capabilities
 * @param certificate  eUICC certificate
 */
public record EuiccInformationSet(String euiccId,
                                  String eid,
                                  String svn,
                                  int freeMemory,
                                  EuiccCapabilities capabilities,
                                  X509Certificate certificate) {
}
