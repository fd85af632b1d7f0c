package org.m2mrsp.protocol.model;

import java.util.Map;

/**
 * Status probe result of an entity.
 *
 * @param entity   entity name
 * @param counters named counters, in insertion order
 */
public record EntityStatus(String entity, Map<String, Object> counters) {
}
