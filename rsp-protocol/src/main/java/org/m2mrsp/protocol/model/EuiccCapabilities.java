package org.m2mrsp.protocol.model;

import java.util.List;

/**
 * Capabilities advertised in the eUICC information set.
 */
public record EuiccCapabilities(List<String> supportedAlgorithms,
                                boolean secureDomainSupport,
                                boolean pskSupport) {
}
