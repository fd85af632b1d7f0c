package org.m2mrsp.protocol.crypto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Test;
import org.m2mrsp.protocol.exception.DecryptionFailedException;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.model.SessionKeys;

/**
 * Tests for {@link Scp03t}.
 */
class Scp03tTest {

  private static final byte[] SECRET = RspCrypto.sha256("shared".getBytes(StandardCharsets.UTF_8));
  private static final byte[] HOST_CHALLENGE = new byte[16];
  private static final byte[] CARD_CHALLENGE = new byte[16];
  private static final String AID = "A0000005591010DEADBEEF";
  private static final byte[] COUNTER = RspCrypto.int32(1);

  static {
    Arrays.fill(CARD_CHALLENGE, (byte) 0x5A);
  }

  private final SessionKeys keys =
      Scp03t.deriveSessionKeys(SECRET, "SM-DP", "89012345678901234567", HOST_CHALLENGE, CARD_CHALLENGE);

  // ── Keys ─────────────────────────────────────────────────────────────────

  @Test
  void deriveSessionKeys_produces16ByteDistinctKeys() {
    assertThat(keys.sEnc()).hasSize(16);
    assertThat(keys.sMac()).hasSize(16);
    assertThat(keys.sRmac()).hasSize(16);
    assertThat(keys.sEnc()).isNotEqualTo(keys.sMac()).isNotEqualTo(keys.sRmac());
  }

  /**
   * Swapping the challenges changes every key.
   */
  @Test
  void deriveSessionKeys_bindsChallengeOrder() {
    SessionKeys swapped =
        Scp03t.deriveSessionKeys(SECRET, "SM-DP", "89012345678901234567", CARD_CHALLENGE, HOST_CHALLENGE);

    assertThat(swapped).isNotEqualTo(keys);
  }

  // ── Encryption ───────────────────────────────────────────────────────────

  @Test
  void encryptCommand_roundTrip() {
    byte[] data = "profile data".getBytes(StandardCharsets.UTF_8);

    byte[] encrypted = Scp03t.encryptCommand(data, keys.sEnc());

    assertThat(encrypted).hasSize(16);
    assertThat(Scp03t.decryptResponse(encrypted, keys.sEnc())).isEqualTo(data);
  }

  /**
   * Full-block input gains a padding block.
   */
  @Test
  void encryptCommand_fullBlock_addsPaddingBlock() {
    assertThat(Scp03t.encryptCommand(new byte[16], keys.sEnc())).hasSize(32);
  }

  @Test
  void decryptResponse_partialBlock_throws() {
    assertThatThrownBy(() -> Scp03t.decryptResponse(new byte[15], keys.sEnc()))
        .isInstanceOf(DecryptionFailedException.class);
  }

  // ── MAC ──────────────────────────────────────────────────────────────────

  @Test
  void calculateMac_isEightBytesAndCounterBound() {
    byte[] data = {1, 2, 3};

    byte[] mac1 = Scp03t.calculateMac(data, keys.sMac(), RspCrypto.int32(1));
    byte[] mac2 = Scp03t.calculateMac(data, keys.sMac(), RspCrypto.int32(2));

    assertThat(mac1).hasSize(8).isNotEqualTo(mac2);
    assertThat(Scp03t.calculateMac(data, keys.sMac(), null)).hasSize(8).isNotEqualTo(mac1);
  }

  @Test
  void verifyMac_tamperedData_throws() {
    byte[] data = {1, 2, 3};
    byte[] mac = Scp03t.calculateMac(data, keys.sMac(), COUNTER);

    Scp03t.verifyMac(data, mac, keys.sMac(), COUNTER);
    assertThatThrownBy(() -> Scp03t.verifyMac(new byte[]{1, 2, 4}, mac, keys.sMac(), COUNTER))
        .isInstanceOf(MacVerificationFailedException.class);
  }

  // ── APDU framing ─────────────────────────────────────────────────────────

  @Test
  void formatApdu_case1_headerOnly() {
    assertThat(Scp03t.formatApdu(0x80, 0xE6, 0x02, 0x00, null, 0))
        .containsExactly(0x80, 0xE6, 0x02, 0x00);
  }

  @Test
  void formatApdu_case2_shortLe_256EncodesAsZero() {
    assertThat(Scp03t.formatApdu(0x00, 0xC0, 0x00, 0x00, null, 256))
        .containsExactly(0x00, 0xC0, 0x00, 0x00, 0x00);
    assertThat(Scp03t.formatApdu(0x00, 0xC0, 0x00, 0x00, null, 16))
        .containsExactly(0x00, 0xC0, 0x00, 0x00, 0x10);
  }

  @Test
  void formatApdu_case4_extendedLcAndLe() {
    byte[] data = new byte[300];

    byte[] apdu = Scp03t.formatApdu(0x80, 0xE6, 0x02, 0x00, data, 1024);

    assertThat(apdu).hasSize(4 + 3 + 300 + 3);
    assertThat(Arrays.copyOfRange(apdu, 4, 7)).containsExactly(0x00, 0x01, 0x2C);
    assertThat(Arrays.copyOfRange(apdu, 307, 310)).containsExactly(0x00, 0x04, 0x00);
  }

  @Test
  void formatApdu_case3_shortLc() {
    byte[] apdu = Scp03t.formatApdu(0x80, 0xE6, 0x02, 0x00, new byte[]{9, 9}, 0);

    assertThat(apdu).containsExactly(0x80, 0xE6, 0x02, 0x00, 0x02, 0x09, 0x09);
  }

  // ── INSTALL ──────────────────────────────────────────────────────────────

  @Test
  void buildInstallApdu_openRoundTrip() {
    byte[] data = "segment".getBytes(StandardCharsets.UTF_8);

    byte[] apdu = Scp03t.buildInstallApdu(keys, COUNTER, AID, data);

    assertThat(Arrays.copyOf(apdu, 4)).containsExactly(0x80, 0xE6, 0x02, 0x00);
    assertThat(Scp03t.openInstallApdu(apdu, keys, COUNTER, AID)).isEqualTo(data);
  }

  /**
   * Large segments use the extended Lc form and still open.
   */
  @Test
  void buildInstallApdu_largeData_usesExtendedLength() {
    byte[] data = new byte[1024];
    Arrays.fill(data, (byte) 'x');

    byte[] apdu = Scp03t.buildInstallApdu(keys, COUNTER, AID, data);

    assertThat(apdu[4]).isZero();
    assertThat(Scp03t.openInstallApdu(apdu, keys, COUNTER, AID)).isEqualTo(data);
  }

  @Test
  void openInstallApdu_flippedCiphertextBit_throwsMacFailure() {
    byte[] apdu = Scp03t.buildInstallApdu(keys, COUNTER, AID, new byte[40]);
    apdu[20] ^= 0x01;

    assertThatThrownBy(() -> Scp03t.openInstallApdu(apdu, keys, COUNTER, AID))
        .isInstanceOf(MacVerificationFailedException.class);
  }

  @Test
  void openInstallApdu_otherIsdp_throwsMacFailure() {
    byte[] apdu = Scp03t.buildInstallApdu(keys, COUNTER, AID, new byte[40]);

    assertThatThrownBy(() -> Scp03t.openInstallApdu(apdu, keys, COUNTER, "A000000559101000000001"))
        .isInstanceOf(MacVerificationFailedException.class);
  }

  @Test
  void openInstallApdu_wrongCounter_throwsMacFailure() {
    byte[] apdu = Scp03t.buildInstallApdu(keys, COUNTER, AID, new byte[40]);

    assertThatThrownBy(() -> Scp03t.openInstallApdu(apdu, keys, RspCrypto.int32(2), AID))
        .isInstanceOf(MacVerificationFailedException.class);
  }
}
