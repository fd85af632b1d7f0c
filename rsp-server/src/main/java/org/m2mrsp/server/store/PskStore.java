package org.m2mrsp.server.store;

import java.util.Optional;
import org.m2mrsp.protocol.model.PskRecord;

/**
 * Registry of transport pre-shared keys. Holds exactly one live PSK per eUICC; storing a new
 * record replaces the previous one.
 * <p>
 * Implementations must be thread-safe.
 */
public interface PskStore {

  /**
   * Stores or replaces the PSK of {@code record.euiccId()}.
   *
   * @param record the record
   */
  void put(PskRecord record);

  /**
   * Finds the live PSK of an eUICC.
   *
   * @param euiccId the eUICC
   * @return the record, or empty
   */
  Optional<PskRecord> find(String euiccId);

  /**
   * Finds the live PSK of an eUICC or fails.
   *
   * @param euiccId the eUICC
   * @return the record
   * @throws org.m2mrsp.protocol.exception.PskNotEstablishedException if there is none
   */
  PskRecord require(String euiccId);

  /**
   * Number of eUICCs with a live PSK.
   *
   * @return the count
   */
  int size();
}
