package org.m2mrsp.protocol.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.m2mrsp.protocol.crypto.RspCrypto;
import org.m2mrsp.protocol.exception.ProfileIntegrityException;
import org.m2mrsp.protocol.model.ProfileContent;

/**
 * Canonical JSON encoding, hashing and segmentation of profiles.
 * <p>
 * The canonical form is compact JSON with the property order declared on the model records,
 * so SM-DP and the eUICC hash identical bytes.
 */
public class ProfileCodec {

  public static final int DEFAULT_SEGMENT_SIZE = 1024;

  private final ObjectMapper objectMapper;

  public ProfileCodec(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper.copy()
        .disable(SerializationFeature.INDENT_OUTPUT)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
  }

  public ProfileCodec() {
    this(new ObjectMapper());
  }

  /**
   * Lower-case hex SHA-256 of the canonical JSON of {@code content}.
   */
  public String hash(ProfileContent content) {
    try {
      return RspCrypto.sha256Hex(objectMapper.writeValueAsString(content));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Profile content is not serializable", e);
    }
  }

  public byte[] encode(ProfileImage image) {
    try {
      return objectMapper.writeValueAsBytes(image);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Profile image is not serializable", e);
    }
  }

  /**
   * Parses an image and checks its embedded hash against the content.
   *
   * @throws ProfileIntegrityException if the bytes do not parse or the hash differs
   */
  public ProfileImage decodeVerified(byte[] bytes) {
    ProfileImage image;
    try {
      image = objectMapper.readValue(bytes, ProfileImage.class);
    } catch (IOException e) {
      throw new ProfileIntegrityException("Reassembled profile is not valid JSON", e);
    }
    if (image.profile() == null || image.hash() == null) {
      throw new ProfileIntegrityException("Reassembled profile is incomplete");
    }
    if (!hash(image.profile()).equals(image.hash())) {
      throw new ProfileIntegrityException("Profile hash mismatch for " + image.profile().iccid());
    }
    return image;
  }

  /**
   * Splits {@code data} into consecutive slices of at most {@code segmentSize} bytes.
   */
  public static List<byte[]> segment(byte[] data, int segmentSize) {
    if (segmentSize <= 0) {
      throw new IllegalArgumentException("segmentSize must be positive: " + segmentSize);
    }
    List<byte[]> segments = new ArrayList<>();
    for (int offset = 0; offset < data.length; offset += segmentSize) {
      segments.add(Arrays.copyOfRange(data, offset, Math.min(data.length, offset + segmentSize)));
    }
    return segments;
  }

  public static byte[] reassemble(List<byte[]> segments) {
    return RspCrypto.concat(segments.toArray(new byte[0][]));
  }
}
