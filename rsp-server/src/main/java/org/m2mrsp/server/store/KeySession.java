package org.m2mrsp.server.store;

import java.time.Instant;
import org.m2mrsp.protocol.model.DerivedKeySet;
import org.m2mrsp.protocol.model.EphemeralKeyPair;
import org.m2mrsp.protocol.model.SessionKeys;

/**
 * State of one key establishment attempt, held by the initiating entity.
 * <p>
 * The ephemeral key pair exists only while the session is {@link SessionStep#INITIALIZED};
 * {@link #complete} drops it once the shared secret has been computed.
 *
 * @param sessionId       unique session identifier
 * @param initiator       name of the initiating entity
 * @param peerId          eUICC the session targets
 * @param isdpAid         target ISD-P, null for transport re-keying
 * @param ephemeralKeyPair initiator ephemeral key pair, null once completed
 * @param randomChallenge initiator challenge
 * @param peerPublicKey   peer ephemeral public key, null until completed
 * @param sharedSecret    ECDH shared secret, null until completed
 * @param derivedKeys     {Ke, Km, Ku}, null until completed
 * @param sessionKeys     SCP03t session keys, null until completed
 * @param step            progress
 * @param createdAt       creation time, drives expiry
 */
public record KeySession(String sessionId,
                         String initiator,
                         String peerId,
                         String isdpAid,
                         EphemeralKeyPair ephemeralKeyPair,
                         byte[] randomChallenge,
                         byte[] peerPublicKey,
                         byte[] sharedSecret,
                         DerivedKeySet derivedKeys,
                         SessionKeys sessionKeys,
                         SessionStep step,
                         Instant createdAt) {

  /**
   * Creates a fresh session in step INITIALIZED.
   */
  public static KeySession initialized(String sessionId, String initiator, String peerId,
                                       String isdpAid, EphemeralKeyPair ephemeralKeyPair,
                                       byte[] randomChallenge, Instant createdAt) {
    return new KeySession(sessionId, initiator, peerId, isdpAid, ephemeralKeyPair,
        randomChallenge, null, null, null, null, SessionStep.INITIALIZED, createdAt);
  }

  /**
   * Returns the COMPLETED form of this session with the ephemeral key pair discarded.
   */
  public KeySession complete(byte[] peerKey, byte[] secret, DerivedKeySet keys,
                             SessionKeys scp03tKeys) {
    return new KeySession(sessionId, initiator, peerId, isdpAid, null, randomChallenge,
        peerKey, secret, keys, scp03tKeys, SessionStep.COMPLETED, createdAt);
  }

  @Override
  public String toString() {
    return "KeySession[sessionId=" + sessionId + ", initiator=" + initiator + ", peerId=" + peerId
        + ", isdpAid=" + isdpAid + ", step=" + step + "]";
  }
}
