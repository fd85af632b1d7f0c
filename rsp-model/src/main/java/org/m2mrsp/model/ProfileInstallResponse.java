package org.m2mrsp.model;

import static org.m2mrsp.model.Base64Fields.decode;
import static org.m2mrsp.model.Base64Fields.encode;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.m2mrsp.protocol.model.PskEnvelope;
import org.m2mrsp.protocol.model.PskSegment;

/**
 * One PSK-protected profile segment as SM-SR hands it to the eUICC.
 * <p>
 * Used by: {@code GET /smsr/isdp/{isdpAid}/profile} response (one entry per segment)
 *
 * @param status        always {@code success}
 * @param encryptedData the PSK envelope, base64 fields
 * @param isdpAid       target ISD-P
 * @param index         segment position
 * @param total         segment count
 */
public record ProfileInstallResponse(@JsonProperty("status") String status,
                                     @JsonProperty("encryptedData") EncryptedData encryptedData,
                                     @JsonProperty("isdpAid") String isdpAid,
                                     @JsonProperty("index") int index,
                                     @JsonProperty("total") int total) {

  /**
   * PSK envelope on the wire.
   *
   * @param iv      16-byte IV
   * @param data    AES-CBC ciphertext
   * @param mac     HMAC-SHA256 over iv || data
   * @param keyType {@code AES-128} or {@code AES-256}
   */
  public record EncryptedData(@JsonProperty("iv") String iv,
                              @JsonProperty("data") String data,
                              @JsonProperty("mac") String mac,
                              @JsonProperty("keyType") String keyType) {

    public EncryptedData(PskEnvelope envelope) {
      this(encode(envelope.iv()), encode(envelope.data()), encode(envelope.mac()),
          envelope.keyType());
    }

    public PskEnvelope envelope() {
      return new PskEnvelope(decode(iv, "iv"), decode(data, "data"), decode(mac, "mac"),
          keyType);
    }
  }

  public ProfileInstallResponse(PskSegment segment) {
    this("success", new EncryptedData(segment.envelope()), segment.isdpAid(), segment.index(),
        segment.total());
  }

  public PskSegment segment() {
    return new PskSegment(isdpAid, index, total, encryptedData.envelope());
  }
}
