package org.m2mrsp.protocol.profile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.m2mrsp.protocol.crypto.RspCrypto;
import org.m2mrsp.protocol.exception.ProfileIntegrityException;
import org.m2mrsp.protocol.model.ProfileApplication;
import org.m2mrsp.protocol.model.ProfileContent;
import org.m2mrsp.protocol.model.SimData;

/**
 * Tests for {@link ProfileCodec}.
 */
class ProfileCodecTest {

  private static final ProfileContent CONTENT = new ProfileContent("telecommunication",
      "8901234567890123456", 1_700_000_000_000L,
      new SimData("001123456789012", "00112233445566778899aabbccddeeff",
          "ffeeddccbbaa99887766554433221100"),
      List.of(ProfileApplication.USIM, ProfileApplication.ISIM));

  private final ProfileCodec codec = new ProfileCodec();

  @Test
  void hash_isSha256OfCompactOrderedJson() {
    String json = "{\"profileType\":\"telecommunication\",\"iccid\":\"8901234567890123456\","
        + "\"timestamp\":1700000000000,\"simData\":{\"imsi\":\"001123456789012\","
        + "\"ki\":\"00112233445566778899aabbccddeeff\",\"opc\":\"ffeeddccbbaa99887766554433221100\"},"
        + "\"applications\":[{\"aid\":\"A0000000871002\",\"name\":\"USIM\",\"priority\":1},"
        + "{\"aid\":\"A0000000871004\",\"name\":\"ISIM\",\"priority\":2}]}";

    assertThat(codec.hash(CONTENT)).isEqualTo(RspCrypto.sha256Hex(json));
  }

  @Test
  void decodeVerified_acceptsEncodedImage() {
    byte[] bytes = codec.encode(new ProfileImage(CONTENT, codec.hash(CONTENT)));

    ProfileImage image = codec.decodeVerified(bytes);

    assertThat(image.profile()).isEqualTo(CONTENT);
  }

  @Test
  void decodeVerified_hashMismatch_throws() {
    byte[] bytes = codec.encode(new ProfileImage(CONTENT, "0".repeat(64)));

    assertThatThrownBy(() -> codec.decodeVerified(bytes))
        .isInstanceOf(ProfileIntegrityException.class)
        .hasMessageContaining("8901234567890123456");
  }

  @Test
  void decodeVerified_notJson_throws() {
    assertThatThrownBy(() -> codec.decodeVerified("garbage".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(ProfileIntegrityException.class);
  }

  @Test
  void decodeVerified_missingHash_throws() {
    byte[] bytes = codec.encode(new ProfileImage(CONTENT, null));

    assertThatThrownBy(() -> codec.decodeVerified(bytes))
        .isInstanceOf(ProfileIntegrityException.class);
  }

  @Test
  void segment_splitsIntoBoundedSlicesAndReassembles() {
    byte[] data = new byte[2500];
    for (int i = 0; i < data.length; i++) {
      data[i] = (byte) i;
    }

    List<byte[]> segments = ProfileCodec.segment(data, 1024);

    assertThat(segments).extracting(s -> s.length).containsExactly(1024, 1024, 452);
    assertThat(ProfileCodec.reassemble(segments)).isEqualTo(data);
  }

  @Test
  void segment_nonPositiveSize_throws() {
    assertThatThrownBy(() -> ProfileCodec.segment(new byte[10], 0))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
