package org.m2mrsp.server.store;

/**
 * Progress of a key establishment session.
 */
public enum SessionStep {
  INITIALIZED,
  COMPLETED
}
