package org.m2mrsp.protocol.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.model.SessionKeys;

/**
 * Tests for {@link Scp03tChannel}.
 */
class Scp03tChannelTest {

  private static final String AID = "A000000559101000C0FFEE";

  private Scp03tChannel host;
  private Scp03tChannel card;

  @BeforeEach
  void setUp() {
    SessionKeys keys = Scp03t.deriveSessionKeys(new byte[32], "SM-DP", "card",
        new byte[16], new byte[16]);
    host = new Scp03tChannel(keys);
    card = new Scp03tChannel(keys);
  }

  @Test
  void wrapUnwrap_inOrder_advancesBothCounters() {
    byte[] first = host.wrapInstall(AID, bytes("one"));
    byte[] second = host.wrapInstall(AID, bytes("two"));

    assertThat(card.unwrapInstall(AID, first)).isEqualTo(bytes("one"));
    assertThat(card.unwrapInstall(AID, second)).isEqualTo(bytes("two"));
    assertThat(host.getCounter()).isEqualTo(2);
    assertThat(card.getCounter()).isEqualTo(2);
  }

  /**
   * A replayed APDU carries a stale counter and is rejected without advancing the card.
   */
  @Test
  void unwrap_replayedApdu_throws() {
    byte[] first = host.wrapInstall(AID, bytes("one"));
    card.unwrapInstall(AID, first);

    assertThatThrownBy(() -> card.unwrapInstall(AID, first))
        .isInstanceOf(MacVerificationFailedException.class);
    assertThat(card.getCounter()).isEqualTo(1);
  }

  @Test
  void unwrap_outOfOrder_throws() {
    host.wrapInstall(AID, bytes("one"));
    byte[] second = host.wrapInstall(AID, bytes("two"));

    assertThatThrownBy(() -> card.unwrapInstall(AID, second))
        .isInstanceOf(MacVerificationFailedException.class);
  }

  private static byte[] bytes(String s) {
    return s.getBytes(StandardCharsets.UTF_8);
  }
}
