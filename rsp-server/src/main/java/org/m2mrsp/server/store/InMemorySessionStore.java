package org.m2mrsp.server.store;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import org.m2mrsp.protocol.exception.InvalidSessionException;
import org.m2mrsp.protocol.exception.SessionExpiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent in-memory {@link SessionStore} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Expired sessions are lazily evicted on lookup and periodically by a daemon reaper thread.
 * All sessions are lost on restart.
 */
public class InMemorySessionStore implements SessionStore {

  private static final Logger log = LoggerFactory.getLogger(InMemorySessionStore.class);

  /**
   * Default session time-to-live.
   */
  public static final Duration DEFAULT_TTL = Duration.ofSeconds(120);

  private final ConcurrentHashMap<String, KeySession> store = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;
  private final ScheduledExecutorService sessionReaper;

  /**
   * Creates a store with the default TTL, the system clock and a running reaper.
   */
  public InMemorySessionStore() {
    this(DEFAULT_TTL, Clock.systemUTC(), true);
  }

  /**
   * Instantiates a new In memory session store.
   *
   * @param ttl           session time-to-live
   * @param clock         time source
   * @param startReaper   whether to evict expired sessions in the background
   */
  public InMemorySessionStore(Duration ttl, Clock clock, boolean startReaper) {
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    this.ttl = ttl;
    this.clock = clock;
    if (startReaper) {
      this.sessionReaper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "rsp-session-reaper");
        t.setDaemon(true);
        return t;
      });
      long periodMillis = Math.max(1_000L, ttl.toMillis() / 4);
      sessionReaper.scheduleAtFixedRate(this::evictExpired, periodMillis, periodMillis,
          TimeUnit.MILLISECONDS);
    } else {
      this.sessionReaper = null;
    }
  }

  @Override
  public void store(KeySession session) {
    store.put(session.sessionId(), session);
    log.debug("Stored session {}", session.sessionId());
  }

  @Override
  public Optional<KeySession> load(String sessionId) {
    KeySession session = store.get(sessionId);
    if (session == null) {
      return Optional.empty();
    }
    if (isExpired(session)) {
      store.remove(sessionId, session);
      return Optional.empty();
    }
    return Optional.of(session);
  }

  @Override
  public KeySession require(String sessionId) {
    KeySession session = store.get(sessionId);
    if (session == null) {
      throw new InvalidSessionException("Invalid session ID");
    }
    if (isExpired(session)) {
      store.remove(sessionId, session);
      log.debug("Session {} expired", sessionId);
      throw new SessionExpiredException("Session expired");
    }
    return session;
  }

  @Override
  public KeySession update(String sessionId, UnaryOperator<KeySession> change) {
    AtomicBoolean expired = new AtomicBoolean();
    KeySession updated = store.computeIfPresent(sessionId, (id, current) -> {
      if (isExpired(current)) {
        expired.set(true);
        return null;
      }
      return change.apply(current);
    });
    if (expired.get()) {
      log.debug("Session {} expired", sessionId);
      throw new SessionExpiredException("Session expired");
    }
    if (updated == null) {
      throw new InvalidSessionException("Invalid session ID");
    }
    return updated;
  }

  @Override
  public void revoke(String sessionId) {
    if (store.remove(sessionId) != null) {
      log.debug("Revoked session {}", sessionId);
    }
  }

  @Override
  public int size() {
    return store.size();
  }

  /**
   * Shuts down the reaper thread. Call on server stop to release the thread.
   */
  public void shutdown() {
    if (sessionReaper != null) {
      sessionReaper.shutdownNow();
    }
  }

  void evictExpired() {
    // Evict individually so a session created just now is not swept with an old one.
    int before = store.size();
    store.entrySet().removeIf(e -> isExpired(e.getValue()));
    int evicted = before - store.size();
    if (evicted > 0) {
      log.debug("Evicted {} expired session(s)", evicted);
    }
  }

  private boolean isExpired(KeySession session) {
    return session.createdAt().plus(ttl).isBefore(clock.instant());
  }
}
