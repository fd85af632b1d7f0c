package org.m2mrsp.protocol.isdp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.m2mrsp.protocol.exception.EuiccNotRegisteredException;
import org.m2mrsp.protocol.exception.InsufficientMemoryException;
import org.m2mrsp.protocol.exception.InvalidIsdpStateException;
import org.m2mrsp.protocol.exception.ProfileNotFoundException;
import org.m2mrsp.protocol.model.IsdpRecord;
import org.m2mrsp.protocol.model.IsdpState;

/**
 * Tests for {@link IsdpLifecycleManager}.
 */
class IsdpLifecycleManagerTest {

  private static final String EUICC = "89012345678901234567";
  private static final String ICCID = "8901234567890123456";

  private IsdpLifecycleManager manager;

  @BeforeEach
  void setUp() {
    manager = new IsdpLifecycleManager();
    manager.registerEuicc(EUICC, 1024);
  }

  @Test
  void create_reservesMemoryAndUsesAidPattern() {
    IsdpRecord record = manager.create(EUICC, 256);

    assertThat(record.isdpAid()).matches("A0000005591010[0-9A-F]{8}");
    assertThat(record.state()).isEqualTo(IsdpState.CREATED);
    assertThat(record.iccid()).isNull();
    assertThat(manager.availableMemory(EUICC)).isEqualTo(768);
    assertThat(manager.ownedAids(EUICC)).containsExactly(record.isdpAid());
  }

  /**
   * A request that does not fit fails and leaves nothing behind.
   */
  @Test
  void create_insufficientMemory_createsNoRecord() {
    assertThatThrownBy(() -> manager.create(EUICC, 2048))
        .isInstanceOf(InsufficientMemoryException.class)
        .hasMessage("Not enough memory");

    assertThat(manager.count()).isZero();
    assertThat(manager.availableMemory(EUICC)).isEqualTo(1024);
  }

  @Test
  void create_unknownEuicc_throws() {
    assertThatThrownBy(() -> manager.create("unknown", 1))
        .isInstanceOf(EuiccNotRegisteredException.class);
  }

  @Test
  void create_nonPositiveMemory_throws() {
    assertThatThrownBy(() -> manager.create(EUICC, 0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void fullLifecycle_followsAllowedTransitions() {
    String aid = manager.create(EUICC, 256).isdpAid();

    assertThat(manager.upload(aid).state()).isEqualTo(IsdpState.UPLOADED);
    IsdpRecord installed = manager.install(aid, ICCID);
    assertThat(installed.state()).isEqualTo(IsdpState.INSTALLED);
    assertThat(installed.iccid()).isEqualTo(ICCID);
    assertThat(manager.enable(aid).state()).isEqualTo(IsdpState.ENABLED);
    assertThat(manager.disable(aid).state()).isEqualTo(IsdpState.DISABLED);
    assertThat(manager.enable(aid).state()).isEqualTo(IsdpState.ENABLED);
    assertThat(manager.delete(aid).state()).isEqualTo(IsdpState.DELETED);
    assertThat(manager.availableMemory(EUICC)).isEqualTo(1024);
  }

  @Test
  void install_directlyFromCreated_isAllowed() {
    String aid = manager.create(EUICC, 256).isdpAid();

    assertThat(manager.install(aid, ICCID).state()).isEqualTo(IsdpState.INSTALLED);
  }

  /**
   * Enabling an ISD-P that never received a profile reports the missing profile.
   */
  @Test
  void enable_withoutProfile_throwsProfileNotFound() {
    String aid = manager.create(EUICC, 256).isdpAid();

    assertThatThrownBy(() -> manager.enable(aid)).isInstanceOf(ProfileNotFoundException.class);
    assertThat(manager.require(aid).state()).isEqualTo(IsdpState.CREATED);
  }

  @Test
  void enable_twice_throwsInvalidState() {
    String aid = manager.create(EUICC, 256).isdpAid();
    manager.install(aid, ICCID);
    manager.enable(aid);

    assertThatThrownBy(() -> manager.enable(aid)).isInstanceOf(InvalidIsdpStateException.class);
  }

  @Test
  void disable_whenInstalled_throwsInvalidState() {
    String aid = manager.create(EUICC, 256).isdpAid();
    manager.install(aid, ICCID);

    assertThatThrownBy(() -> manager.disable(aid)).isInstanceOf(InvalidIsdpStateException.class);
  }

  /**
   * DELETED is terminal.
   */
  @Test
  void deleted_rejectsEveryTransition() {
    String aid = manager.create(EUICC, 256).isdpAid();
    manager.delete(aid);

    assertThatThrownBy(() -> manager.upload(aid)).isInstanceOf(InvalidIsdpStateException.class);
    assertThatThrownBy(() -> manager.install(aid, ICCID)).isInstanceOf(InvalidIsdpStateException.class);
    assertThatThrownBy(() -> manager.enable(aid)).isInstanceOf(InvalidIsdpStateException.class);
    assertThatThrownBy(() -> manager.delete(aid)).isInstanceOf(InvalidIsdpStateException.class);
    assertThat(manager.availableMemory(EUICC)).isEqualTo(1024);
  }

  @Test
  void upload_unknownAid_throws() {
    assertThatThrownBy(() -> manager.upload("A000000559101000000000"))
        .isInstanceOf(InvalidIsdpStateException.class);
  }

  /**
   * Concurrent creates never over-commit the declared memory.
   */
  @Test
  void create_concurrent_neverExceedsMemory() throws Exception {
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<Boolean>> results = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        results.add(pool.submit(() -> {
          try {
            manager.create(EUICC, 100);
            return true;
          } catch (InsufficientMemoryException e) {
            return false;
          }
        }));
      }
      int created = 0;
      for (Future<Boolean> f : results) {
        if (f.get()) {
          created++;
        }
      }
      assertThat(created).isEqualTo(10);
      assertThat(manager.count()).isEqualTo(10);
      assertThat(manager.availableMemory(EUICC)).isEqualTo(24);
    } finally {
      pool.shutdownNow();
    }
  }
}
