package org.m2mrsp.server.entity;

import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.m2mrsp.protocol.crypto.Ecdh;
import org.m2mrsp.protocol.crypto.KeyEstablishment;
import org.m2mrsp.protocol.crypto.NistKdf;
import org.m2mrsp.protocol.crypto.PskCipher;
import org.m2mrsp.protocol.crypto.RspCrypto;
import org.m2mrsp.protocol.crypto.Scp03t;
import org.m2mrsp.protocol.crypto.Scp03tChannel;
import org.m2mrsp.protocol.exception.InsufficientMemoryException;
import org.m2mrsp.protocol.exception.InvalidIsdpStateException;
import org.m2mrsp.protocol.exception.InvalidSessionException;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.exception.ProfileNotFoundException;
import org.m2mrsp.protocol.exception.PskNotEstablishedException;
import org.m2mrsp.protocol.exception.SignatureVerificationFailedException;
import org.m2mrsp.protocol.identity.CertificateVerifier;
import org.m2mrsp.protocol.identity.Certificates;
import org.m2mrsp.protocol.identity.EntityIdentity;
import org.m2mrsp.protocol.model.DerivedKeySet;
import org.m2mrsp.protocol.model.EntityStatus;
import org.m2mrsp.protocol.model.EphemeralKeyPair;
import org.m2mrsp.protocol.model.Es8Command;
import org.m2mrsp.protocol.model.Es8Response;
import org.m2mrsp.protocol.model.EuiccCapabilities;
import org.m2mrsp.protocol.model.EuiccInformationSet;
import org.m2mrsp.protocol.model.KeyEstablishmentOffer;
import org.m2mrsp.protocol.model.KeyEstablishmentReceipt;
import org.m2mrsp.protocol.model.KeyEstablishmentResponse;
import org.m2mrsp.protocol.model.ProfileStatus;
import org.m2mrsp.protocol.model.PskEnvelope;
import org.m2mrsp.protocol.model.PskRekeyOffer;
import org.m2mrsp.protocol.model.PskRekeyResponse;
import org.m2mrsp.protocol.model.PskSegment;
import org.m2mrsp.protocol.model.SegmentAck;
import org.m2mrsp.protocol.model.SessionKeys;
import org.m2mrsp.protocol.profile.ProfileCodec;
import org.m2mrsp.protocol.profile.ProfileImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded UICC.
 * <p>
 * Responder side of key establishment with SM-DP, receiver of SCP03t-protected profile segments
 * and executor of ES8 commands from SM-SR. A card handles one command at a time, so every
 * public operation is serialized on the instance.
 */
public class Euicc {

  private static final Logger log = LoggerFactory.getLogger(Euicc.class);

  public static final String SVN = "2.1.0";
  public static final List<String> SUPPORTED_ALGORITHMS = List.of("ECDH-P256", "AES-128", "AES-256",
      "HMAC-SHA256");

  private final String euiccId;
  private final EntityIdentity identity;
  private final CertificateVerifier certificateVerifier;
  private final Ecdh ecdh;
  private final PskCipher pskCipher;
  private final ProfileCodec profileCodec;
  private final Clock clock;

  private int freeMemory;
  private byte[] psk;
  private PendingRekey pendingRekey;
  private final Map<String, Integer> isdps = new LinkedHashMap<>();
  private final Map<String, CardSession> cardSessions = new HashMap<>();
  // live only while the session's ISD-P awaits its profile
  private final Map<String, DerivedKeySet> keysBySession = new HashMap<>();
  private final Map<String, InstalledProfile> profiles = new LinkedHashMap<>();

  /**
   * Instantiates a new eUICC.
   *
   * @param euiccId             eUICC identifier
   * @param identity            long-term identity
   * @param certificateVerifier verifier for SM-DP and SM-SR certificates
   * @param ecdh                ECDH engine
   * @param pskCipher           transport cipher shared with SM-SR
   * @param profileCodec        profile image decoding
   * @param freeMemory          memory available for ISD-Ps
   * @param clock               time source
   */
  public Euicc(String euiccId,
               EntityIdentity identity,
               CertificateVerifier certificateVerifier,
               Ecdh ecdh,
               PskCipher pskCipher,
               ProfileCodec profileCodec,
               int freeMemory,
               Clock clock) {
    if (freeMemory < 0) {
      throw new IllegalArgumentException("freeMemory must not be negative: " + freeMemory);
    }
    this.euiccId = euiccId;
    this.identity = identity;
    this.certificateVerifier = certificateVerifier;
    this.ecdh = ecdh;
    this.pskCipher = pskCipher;
    this.profileCodec = profileCodec;
    this.freeMemory = freeMemory;
    this.clock = clock;
  }

  public synchronized EuiccInformationSet informationSet() {
    return new EuiccInformationSet(euiccId, "89" + euiccId, SVN, freeMemory,
        new EuiccCapabilities(SUPPORTED_ALGORITHMS, true, true), identity.getCertificate());
  }

  /**
   * Installs the transport PSK issued by SM-SR at registration.
   */
  public synchronized void installPsk(byte[] newPsk) {
    PskCipher.keyType(newPsk);
    this.psk = newPsk.clone();
    log.debug("eUICC {} installed {} transport PSK", euiccId, PskCipher.keyType(newPsk));
  }

  // ── Key establishment with SM-DP ─────────────────────────────────────────

  /**
   * Answers an SM-DP offer. The offer signature is checked against the SM-DP certificate before
   * any key material is generated; the resulting SCP03t channel is bound to the offered ISD-P.
   *
   * @param offer the SM-DP offer
   * @return the response carrying the eUICC key, card challenge and signed receipt
   */
  public synchronized KeyEstablishmentResponse respondToKeyEstablishment(
      KeyEstablishmentOffer offer) {
    log.debug("respondToKeyEstablishment({}, {})", offer.sessionId(), offer.isdpAid());
    X509Certificate hostCertificate = offer.certificate();
    certificateVerifier.verify(hostCertificate);
    byte[] signed = KeyEstablishment.offerData(offer.publicKey(), offer.randomChallenge(),
        offer.isdpAid());
    if (!EntityIdentity.verify(offer.signature(), signed, hostCertificate.getPublicKey())) {
      throw new SignatureVerificationFailedException("Invalid SM-DP offer signature");
    }
    if (!isdps.containsKey(offer.isdpAid())) {
      throw new InvalidIsdpStateException("Unknown ISD-P " + offer.isdpAid());
    }
    EphemeralKeyPair keyPair = ecdh.generateKeyPair();
    byte[] sharedSecret = ecdh.computeSharedSecret(keyPair.privateScalar(), offer.publicKey());
    DerivedKeySet keys = NistKdf.deriveKeySet(sharedSecret);
    byte[] cardChallenge = ecdh.generateRandomChallenge();
    byte[] mac = KeyEstablishment.receiptMac(keys.km(), offer.randomChallenge(), cardChallenge,
        keyPair.publicKey(), offer.publicKey());
    KeyEstablishmentReceipt receipt = new KeyEstablishmentReceipt(mac, identity.sign(mac));
    SessionKeys sessionKeys = Scp03t.deriveSessionKeys(sharedSecret,
        Certificates.commonName(hostCertificate), euiccId, offer.randomChallenge(),
        cardChallenge);
    closeSession(offer.isdpAid());
    cardSessions.put(offer.isdpAid(), new CardSession(offer.sessionId(),
        new Scp03tChannel(sessionKeys)));
    keysBySession.put(offer.sessionId(), keys);
    return new KeyEstablishmentResponse(offer.sessionId(), keyPair.publicKey(), cardChallenge,
        receipt, identity.getCertificate());
  }

  /**
   * Keys this card derived for a session. Available until the session's profile is installed,
   * its download fails or its ISD-P is deleted.
   */
  public synchronized DerivedKeySet derivedKeys(String sessionId) {
    DerivedKeySet keys = keysBySession.get(sessionId);
    if (keys == null) {
      throw new InvalidSessionException("No keys for session " + sessionId);
    }
    return keys;
  }

  // ── ES8 ──────────────────────────────────────────────────────────────────

  /**
   * Executes a PSK-protected ES8 command and returns the PSK-protected response.
   */
  public synchronized PskEnvelope handleEs8(PskEnvelope envelope) {
    byte[] key = requirePsk();
    Es8Command command = pskCipher.decryptObject(envelope, key, Es8Command.class);
    log.debug("eUICC {} ES8 {} {}", euiccId, command.command(), command.isdpAid());
    Es8Response response = switch (command.command()) {
      case CREATE_ISDP -> createIsdp(command);
      case ENABLE_PROFILE -> changeProfileStatus(command, ProfileStatus.ENABLED);
      case DISABLE_PROFILE -> changeProfileStatus(command, ProfileStatus.DISABLED);
      case DELETE_ISDP -> deleteIsdp(command);
    };
    return pskCipher.encryptObject(response, key);
  }

  private Es8Response createIsdp(Es8Command command) {
    int memory = command.memory() == null ? 0 : command.memory();
    if (memory <= 0) {
      throw new IllegalArgumentException("ISD-P memory must be positive: " + memory);
    }
    if (isdps.containsKey(command.isdpAid())) {
      throw new InvalidIsdpStateException("ISD-P " + command.isdpAid() + " already exists");
    }
    if (memory > freeMemory) {
      throw new InsufficientMemoryException(memory, freeMemory);
    }
    freeMemory -= memory;
    isdps.put(command.isdpAid(), memory);
    return new Es8Response(Es8Response.SUCCESS, command.command(), command.isdpAid(), null, null);
  }

  private Es8Response changeProfileStatus(Es8Command command, ProfileStatus target) {
    InstalledProfile profile = profileIn(command.isdpAid())
        .orElseThrow(() -> new ProfileNotFoundException(
            "No profile installed in ISD-P " + command.isdpAid()));
    if (profile.status == target) {
      throw new InvalidIsdpStateException("Profile " + profile.iccid + " is already "
          + target.value());
    }
    profile.status = target;
    log.info("eUICC {} profile {} is now {}", euiccId, profile.iccid, target.value());
    return new Es8Response(Es8Response.SUCCESS, command.command(), command.isdpAid(),
        profile.iccid, target);
  }

  private Es8Response deleteIsdp(Es8Command command) {
    Integer allocated = isdps.remove(command.isdpAid());
    if (allocated == null) {
      throw new InvalidIsdpStateException("Unknown ISD-P " + command.isdpAid());
    }
    freeMemory += allocated;
    closeSession(command.isdpAid());
    profiles.values().removeIf(p -> p.isdpAid.equals(command.isdpAid()));
    return new Es8Response(Es8Response.SUCCESS, command.command(), command.isdpAid(), null, null);
  }

  private void closeSession(String isdpAid) {
    CardSession closed = cardSessions.remove(isdpAid);
    if (closed != null) {
      keysBySession.remove(closed.sessionId);
    }
  }

  private Optional<InstalledProfile> profileIn(String isdpAid) {
    return profiles.values().stream().filter(p -> p.isdpAid.equals(isdpAid)).findFirst();
  }

  // ── Profile download ─────────────────────────────────────────────────────

  /**
   * Accepts one segment of a bound profile package. Segments must arrive in order; the last one
   * triggers reassembly, integrity verification and installation.
   *
   * @param segment PSK-protected segment relayed by SM-SR
   * @return acknowledgement, {@code complete} once the profile is installed
   */
  public synchronized SegmentAck receiveSegment(PskSegment segment) {
    byte[] apdu = pskCipher.decrypt(segment.envelope(), requirePsk());
    CardSession session = cardSessions.get(segment.isdpAid());
    if (session == null) {
      throw new InvalidSessionException("No secure channel for ISD-P " + segment.isdpAid());
    }
    if (segment.index() != session.received.size()) {
      throw new MacVerificationFailedException("Segment " + segment.index() + " out of order");
    }
    session.received.add(session.channel.unwrapInstall(segment.isdpAid(), apdu));
    if (session.received.size() < segment.total()) {
      return new SegmentAck(segment.isdpAid(), segment.index(), false);
    }
    ProfileImage image;
    try {
      image = profileCodec.decodeVerified(ProfileCodec.reassemble(session.received));
    } finally {
      closeSession(segment.isdpAid());
    }
    String iccid = image.profile().iccid();
    profiles.put(iccid, new InstalledProfile(iccid, segment.isdpAid(), image.hash()));
    log.info("eUICC {} installed profile {} in ISD-P {}", euiccId, iccid, segment.isdpAid());
    return new SegmentAck(segment.isdpAid(), segment.index(), true);
  }

  public synchronized Optional<ProfileStatus> profileStatus(String iccid) {
    return Optional.ofNullable(profiles.get(iccid)).map(p -> p.status);
  }

  public synchronized Optional<String> profileHash(String iccid) {
    return Optional.ofNullable(profiles.get(iccid)).map(p -> p.hash);
  }

  // ── Transport PSK re-keying ──────────────────────────────────────────────

  /**
   * Answers an SM-SR re-key offer. The derived PSK stays pending until SM-SR confirms it; a newer
   * offer replaces any re-key still pending.
   */
  public synchronized PskRekeyResponse respondToPskRekey(PskRekeyOffer offer) {
    certificateVerifier.verify(offer.certificate());
    if (!euiccId.equals(offer.euiccId())) {
      throw new InvalidSessionException("Re-key offer addressed to " + offer.euiccId());
    }
    byte[] signed = KeyEstablishment.offerData(offer.publicKey(), offer.challenge(), euiccId);
    if (!EntityIdentity.verify(offer.signature(), signed, offer.certificate().getPublicKey())) {
      throw new SignatureVerificationFailedException("Invalid SM-SR re-key signature");
    }
    EphemeralKeyPair keyPair = ecdh.generateKeyPair();
    byte[] shared = ecdh.computeSharedSecret(keyPair.privateScalar(), offer.publicKey());
    pendingRekey = new PendingRekey(offer.sessionId(),
        KeyEstablishment.establishedPsk(shared, offer.challenge(), euiccId));
    byte[] answer = KeyEstablishment.offerData(keyPair.publicKey(), offer.challenge(), euiccId);
    return new PskRekeyResponse(offer.sessionId(), keyPair.publicKey(), identity.sign(answer),
        identity.getCertificate());
  }

  /**
   * Switches to the pending PSK once SM-SR proves it holds the same key. A pending re-key gets
   * one confirmation attempt.
   */
  public synchronized void confirmPskRekey(String sessionId, byte[] confirmation) {
    if (pendingRekey == null || !pendingRekey.sessionId.equals(sessionId)) {
      throw new InvalidSessionException("No pending re-key for session " + sessionId);
    }
    byte[] pending = pendingRekey.psk;
    pendingRekey = null;
    if (!RspCrypto.constantTimeEquals(KeyEstablishment.pskConfirmation(pending, sessionId),
        confirmation)) {
      throw new MacVerificationFailedException("PSK confirmation failed");
    }
    psk = pending;
    log.info("eUICC {} switched to {} transport PSK at {}", euiccId, PskCipher.keyType(psk),
        clock.instant());
  }

  // ── Status ────────────────────────────────────────────────────────────────

  public synchronized EntityStatus status() {
    Map<String, Object> counters = new LinkedHashMap<>();
    counters.put("euicc_id", euiccId);
    counters.put("has_psk", psk != null);
    counters.put("installed_profiles", profiles.size());
    counters.put("isdps", isdps.size());
    counters.put("has_keys", !keysBySession.isEmpty());
    counters.put("rekey_pending", pendingRekey != null);
    counters.put("free_memory", freeMemory);
    return new EntityStatus(identity.getName(), counters);
  }

  public synchronized int getFreeMemory() {
    return freeMemory;
  }

  public synchronized boolean hasIsdp(String isdpAid) {
    return isdps.containsKey(isdpAid);
  }

  public String getEuiccId() {
    return euiccId;
  }

  public EntityIdentity getIdentity() {
    return identity;
  }

  private byte[] requirePsk() {
    if (psk == null) {
      throw new PskNotEstablishedException("eUICC " + euiccId + " has no transport PSK");
    }
    return psk;
  }

  private static final class CardSession {
    private final String sessionId;
    private final Scp03tChannel channel;
    private final List<byte[]> received = new ArrayList<>();

    private CardSession(String sessionId, Scp03tChannel channel) {
      this.sessionId = sessionId;
      this.channel = channel;
    }

    @Override
    public String toString() {
      return "CardSession[" + sessionId + ", " + received.size() + " segment(s)]";
    }
  }

  private static final class PendingRekey {
    private final String sessionId;
    private final byte[] psk;

    private PendingRekey(String sessionId, byte[] psk) {
      this.sessionId = sessionId;
      this.psk = psk;
    }
  }

  private static final class InstalledProfile {
    private final String iccid;
    private final String isdpAid;
    private final String hash;
    private ProfileStatus status = ProfileStatus.INSTALLED;

    private InstalledProfile(String iccid, String isdpAid, String hash) {
      this.iccid = iccid;
      this.isdpAid = isdpAid;
      this.hash = hash;
    }
  }
}
