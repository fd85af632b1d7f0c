package org.m2mrsp.protocol.isdp;

import java.time.Clock;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import org.m2mrsp.protocol.RandomProvider;
import org.m2mrsp.protocol.exception.EuiccNotRegisteredException;
import org.m2mrsp.protocol.exception.InsufficientMemoryException;
import org.m2mrsp.protocol.exception.InvalidIsdpStateException;
import org.m2mrsp.protocol.exception.ProfileNotFoundException;
import org.m2mrsp.protocol.model.IsdpRecord;
import org.m2mrsp.protocol.model.IsdpState;
import org.m2mrsp.protocol.model.Scp03Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks ISD-P records and the free memory of each registered eUICC.
 * <p>
 * Allowed transitions:
 * <pre>
 *   CREATED  -upload-&gt;  UPLOADED
 *   CREATED | UPLOADED  -install-&gt;  INSTALLED
 *   INSTALLED | DISABLED  -enable-&gt;  ENABLED
 *   ENABLED  -disable-&gt;  DISABLED
 *   any but DELETED  -delete-&gt;  DELETED
 * </pre>
 * Every transition is applied atomically per ISD-P. Memory is reserved on create and returned
 * on delete; a create that does not fit leaves no record behind.
 */
public class IsdpLifecycleManager {

  private static final Logger log = LoggerFactory.getLogger(IsdpLifecycleManager.class);

  public static final String AID_PREFIX = "A0000005591010";
  private static final int AID_SUFFIX_BYTES = 4;

  private final RandomProvider randomProvider;
  private final Clock clock;
  private final ConcurrentHashMap<String, IsdpRecord> records = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Integer> freeMemory = new ConcurrentHashMap<>();

  public IsdpLifecycleManager(RandomProvider randomProvider, Clock clock) {
    this.randomProvider = randomProvider;
    this.clock = clock;
  }

  public IsdpLifecycleManager() {
    this(new RandomProvider(), Clock.systemUTC());
  }

  /**
   * Declares an eUICC and the memory it has free for ISD-Ps. Re-registering replaces the
   * declared value.
   */
  public void registerEuicc(String euiccId, int availableMemory) {
    if (availableMemory < 0) {
      throw new IllegalArgumentException("availableMemory must not be negative");
    }
    freeMemory.put(euiccId, availableMemory);
    log.debug("registerEuicc({}, {})", euiccId, availableMemory);
  }

  /**
   * Creates an ISD-P in state CREATED.
   *
   * @param euiccId        owning eUICC
   * @param memoryRequired memory to reserve, must be positive
   * @return the new record
   * @throws EuiccNotRegisteredException if the eUICC was never registered
   * @throws InsufficientMemoryException if the eUICC cannot fit the request
   */
  public IsdpRecord create(String euiccId, int memoryRequired) {
    if (memoryRequired <= 0) {
      throw new IllegalArgumentException("memoryRequired must be positive: " + memoryRequired);
    }
    freeMemory.compute(euiccId, (id, free) -> {
      if (free == null) {
        throw new EuiccNotRegisteredException("Unknown eUICC " + id);
      }
      if (memoryRequired > free) {
        throw new InsufficientMemoryException(memoryRequired, free);
      }
      return free - memoryRequired;
    });
    IsdpRecord record;
    do {
      String aid = AID_PREFIX + randomProvider.randomHex(AID_SUFFIX_BYTES);
      record = new IsdpRecord(aid, euiccId, memoryRequired, IsdpState.CREATED, null,
          Scp03Parameters.DEFAULT, clock.instant());
    } while (records.putIfAbsent(record.isdpAid(), record) != null);
    log.info("Created ISD-P {} on {} ({} reserved)", record.isdpAid(), euiccId, memoryRequired);
    return record;
  }

  /**
   * Marks the profile segments as received.
   */
  public IsdpRecord upload(String isdpAid) {
    return transition(isdpAid, r -> {
      requireState(r, IsdpState.UPLOADED, IsdpState.CREATED);
      return r.withState(IsdpState.UPLOADED);
    });
  }

  /**
   * Installs a profile and binds its ICCID to the ISD-P.
   */
  public IsdpRecord install(String isdpAid, String iccid) {
    Objects.requireNonNull(iccid, "iccid");
    return transition(isdpAid, r -> {
      requireState(r, IsdpState.INSTALLED, IsdpState.CREATED, IsdpState.UPLOADED);
      return r.withProfile(iccid, IsdpState.INSTALLED);
    });
  }

  /**
   * Enables the installed profile.
   *
   * @throws ProfileNotFoundException  if no profile is bound
   * @throws InvalidIsdpStateException if the ISD-P is not INSTALLED or DISABLED
   */
  public IsdpRecord enable(String isdpAid) {
    return transition(isdpAid, r -> {
      if (r.iccid() == null && r.state() != IsdpState.DELETED) {
        throw new ProfileNotFoundException("No profile installed in ISD-P " + isdpAid);
      }
      requireState(r, IsdpState.ENABLED, IsdpState.INSTALLED, IsdpState.DISABLED);
      return r.withState(IsdpState.ENABLED);
    });
  }

  public IsdpRecord disable(String isdpAid) {
    return transition(isdpAid, r -> {
      requireState(r, IsdpState.DISABLED, IsdpState.ENABLED);
      return r.withState(IsdpState.DISABLED);
    });
  }

  /**
   * Deletes the ISD-P and returns its memory to the owning eUICC.
   */
  public IsdpRecord delete(String isdpAid) {
    IsdpRecord deleted = transition(isdpAid, r -> {
      if (r.state() == IsdpState.DELETED) {
        throw new InvalidIsdpStateException("ISD-P " + isdpAid + " is already DELETED");
      }
      return r.withState(IsdpState.DELETED);
    });
    freeMemory.merge(deleted.euiccId(), deleted.memoryAllocated(), Integer::sum);
    return deleted;
  }

  private IsdpRecord transition(String isdpAid, UnaryOperator<IsdpRecord> change) {
    IsdpRecord updated = records.compute(isdpAid, (aid, current) -> {
      if (current == null) {
        throw new InvalidIsdpStateException("Unknown ISD-P " + aid);
      }
      return change.apply(current);
    });
    log.debug("ISD-P {} -> {}", isdpAid, updated.state());
    return updated;
  }

  private static void requireState(IsdpRecord current, IsdpState target, IsdpState... allowed) {
    if (!EnumSet.of(allowed[0], allowed).contains(current.state())) {
      throw new InvalidIsdpStateException("ISD-P " + current.isdpAid() + " is " + current.state()
          + ", cannot move to " + target);
    }
  }

  public Optional<IsdpRecord> find(String isdpAid) {
    return Optional.ofNullable(records.get(isdpAid));
  }

  /**
   * @throws InvalidIsdpStateException if the ISD-P is unknown
   */
  public IsdpRecord require(String isdpAid) {
    return find(isdpAid).orElseThrow(
        () -> new InvalidIsdpStateException("Unknown ISD-P " + isdpAid));
  }

  public List<String> ownedAids(String euiccId) {
    return records.values().stream()
        .filter(r -> r.euiccId().equals(euiccId))
        .map(IsdpRecord::isdpAid)
        .sorted()
        .toList();
  }

  /**
   * @throws EuiccNotRegisteredException if the eUICC was never registered
   */
  public int availableMemory(String euiccId) {
    Integer free = freeMemory.get(euiccId);
    if (free == null) {
      throw new EuiccNotRegisteredException("Unknown eUICC " + euiccId);
    }
    return free;
  }

  public int count() {
    return records.size();
  }
}
