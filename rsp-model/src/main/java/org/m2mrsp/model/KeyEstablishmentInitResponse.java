package org.m2mrsp.model;

import static org.m2mrsp.model.Base64Fields.decode;
import static org.m2mrsp.model.Base64Fields.encode;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.m2mrsp.protocol.identity.Certificates;
import org.m2mrsp.protocol.model.KeyEstablishmentOffer;

/**
 * SM-DP's signed key establishment offer.
 * <p>
 * Byte fields are base64; the certificate is base64 DER.
 * <p>
 * Used by: {@code POST /smdp/key-establishment/init} response
 *
 * @param status          always {@code success}
 * @param sessionId       SM-DP session identifier
 * @param isdpAid         target ISD-P
 * @param publicKey       SM-DP ephemeral public key, uncompressed SEC1
 * @param randomChallenge 16-byte challenge
 * @param signature       ECDSA signature over publicKey || randomChallenge || isdpAid
 * @param certificate     SM-DP certificate
 */
public record KeyEstablishmentInitResponse(
    @JsonProperty("status") String status,
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("isdp_aid") String isdpAid,
    @JsonProperty("public_key") String publicKey,
    @JsonProperty("random_challenge") String randomChallenge,
    @JsonProperty("signature") String signature,
    @JsonProperty("certificate") String certificate) {

  public static final String SUCCESS = "success";

  public KeyEstablishmentInitResponse(KeyEstablishmentOffer offer) {
    this(SUCCESS, offer.sessionId(), offer.isdpAid(), encode(offer.publicKey()),
        encode(offer.randomChallenge()), encode(offer.signature()),
        encode(Certificates.encode(offer.certificate())));
  }

  public KeyEstablishmentOffer offer() {
    return new KeyEstablishmentOffer(sessionId, isdpAid, decode(publicKey, "public_key"),
        decode(randomChallenge, "random_challenge"), decode(signature, "signature"),
        Certificates.decode(decode(certificate, "certificate")));
  }
}
