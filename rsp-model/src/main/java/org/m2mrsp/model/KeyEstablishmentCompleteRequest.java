package org.m2mrsp.model;

import static org.m2mrsp.model.Base64Fields.decode;
import static org.m2mrsp.model.Base64Fields.encode;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.m2mrsp.protocol.identity.Certificates;
import org.m2mrsp.protocol.model.KeyEstablishmentReceipt;
import org.m2mrsp.protocol.model.KeyEstablishmentResponse;

/**
 * The eUICC's answer to a key establishment offer, relayed to SM-DP.
 * <p>
 * Used by: {@code POST /smdp/key-establishment/complete},
 * {@code POST /euicc/{euiccId}/key-establishment} response
 *
 * @param sessionId     SM-DP session being answered
 * @param publicKey     eUICC ephemeral public key
 * @param cardChallenge 16-byte card challenge
 * @param receipt       key confirmation; rejected when absent
 * @param certificate   eUICC certificate, base64 DER
 */
public record KeyEstablishmentCompleteRequest(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("public_key") String publicKey,
    @JsonProperty("card_challenge") String cardChallenge,
    @JsonProperty("receipt") Receipt receipt,
    @JsonProperty("certificate") String certificate) {

  /**
   * Signed key confirmation.
   *
   * @param mac       HMAC-SHA256 under Km
   * @param signature eUICC signature over the MAC
   */
  public record Receipt(@JsonProperty("mac") String mac,
                        @JsonProperty("signature") String signature) {
  }

  public KeyEstablishmentCompleteRequest(KeyEstablishmentResponse response) {
    this(response.sessionId(), encode(response.publicKey()), encode(response.cardChallenge()),
        new Receipt(encode(response.receipt().mac()), encode(response.receipt().signature())),
        encode(Certificates.encode(response.certificate())));
  }

  public KeyEstablishmentResponse response() {
    if (receipt == null) {
      throw new IllegalArgumentException("Missing required field: receipt");
    }
    return new KeyEstablishmentResponse(sessionId, decode(publicKey, "public_key"),
        decode(cardChallenge, "card_challenge"),
        new KeyEstablishmentReceipt(decode(receipt.mac(), "receipt.mac"),
            decode(receipt.signature(), "receipt.signature")),
        Certificates.decode(decode(certificate, "certificate")));
  }
}
