package org.m2mrsp.server.store;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Storage abstraction for key establishment sessions.
 * <p>
 * Implementations must be thread-safe. A session is subject to at most one mutation at a time:
 * {@link #update} must apply its function atomically with respect to other updates and
 * revocations of the same session.
 * <p>
 * <strong>Expiry contract:</strong> a session older than the store's time-to-live must never be
 * returned. Lookups through {@link #require} and {@link #update} distinguish a session that
 * never existed (or was revoked) from one that expired, so callers can report the right error.
 */
public interface SessionStore {

  /**
   * Stores a new session keyed by its id.
   *
   * @param session the session
   */
  void store(KeySession session);

  /**
   * Loads a session, returning empty if not found or expired.
   *
   * @param sessionId session identifier
   * @return the session, or empty
   */
  Optional<KeySession> load(String sessionId);

  /**
   * Loads a session that must exist.
   *
   * @param sessionId session identifier
   * @return the session
   * @throws org.m2mrsp.protocol.exception.SessionExpiredException if the session expired
   * @throws org.m2mrsp.protocol.exception.InvalidSessionException if the session is unknown
   */
  KeySession require(String sessionId);

  /**
   * Atomically replaces a session with {@code change.apply(current)}. If {@code change} throws,
   * the stored session is left untouched and the exception propagates.
   *
   * @param sessionId session identifier
   * @param change    transformation of the current session
   * @return the updated session
   * @throws org.m2mrsp.protocol.exception.SessionExpiredException if the session expired
   * @throws org.m2mrsp.protocol.exception.InvalidSessionException if the session is unknown
   */
  KeySession update(String sessionId, UnaryOperator<KeySession> change);

  /**
   * Removes a session. Removing an unknown session is a no-op.
   *
   * @param sessionId session identifier
   */
  void revoke(String sessionId);

  /**
   * Number of sessions currently held, expired ones included until evicted.
   *
   * @return the count
   */
  int size();
}
