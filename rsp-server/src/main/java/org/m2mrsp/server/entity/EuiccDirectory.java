package org.m2mrsp.server.entity;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.m2mrsp.protocol.exception.EuiccNotRegisteredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The simulated cards reachable from the HTTP surface, keyed by eUICC id.
 */
@Singleton
public class EuiccDirectory {

  private static final Logger log = LoggerFactory.getLogger(EuiccDirectory.class);

  private final Map<String, Euicc> cards = new ConcurrentHashMap<>();

  public void add(Euicc euicc) {
    if (cards.putIfAbsent(euicc.getEuiccId(), euicc) != null) {
      throw new IllegalArgumentException("Duplicate eUICC id: " + euicc.getEuiccId());
    }
    log.info("eUICC {} attached", euicc.getEuiccId());
  }

  public Optional<Euicc> find(String euiccId) {
    return Optional.ofNullable(cards.get(euiccId));
  }

  /**
   * @throws EuiccNotRegisteredException when no card carries the id
   */
  public Euicc require(String euiccId) {
    return find(euiccId)
        .orElseThrow(() -> new EuiccNotRegisteredException("Unknown eUICC: " + euiccId));
  }

  public Collection<Euicc> all() {
    return List.copyOf(cards.values());
  }
}
