package org.m2mrsp.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.m2mrsp.protocol.exception.PskNotEstablishedException;
import org.m2mrsp.protocol.model.PskRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link PskStore}. Keys are lost on restart, which forces every
 * eUICC to register again.
 */
public class InMemoryPskStore implements PskStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryPskStore.class);

  private final ConcurrentHashMap<String, PskRecord> store = new ConcurrentHashMap<>();

  public InMemoryPskStore() {
    log.warn("InMemoryPskStore is not persistent; all pre-shared keys are lost on restart.");
  }

  @Override
  public void put(PskRecord record) {
    PskRecord previous = store.put(record.euiccId(), record);
    log.debug("Stored {} PSK for {} (replaced={})", record.origin(), record.euiccId(),
        previous != null);
  }

  @Override
  public Optional<PskRecord> find(String euiccId) {
    return Optional.ofNullable(store.get(euiccId));
  }

  @Override
  public PskRecord require(String euiccId) {
    return find(euiccId).orElseThrow(
        () -> new PskNotEstablishedException("No PSK established for " + euiccId));
  }

  @Override
  public int size() {
    return store.size();
  }
}
