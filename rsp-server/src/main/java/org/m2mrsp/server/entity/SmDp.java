package org.m2mrsp.server.entity;

import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import javax.inject.Singleton;
import org.m2mrsp.protocol.RandomProvider;
import org.m2mrsp.protocol.crypto.Ecdh;
import org.m2mrsp.protocol.crypto.KeyEstablishment;
import org.m2mrsp.protocol.crypto.NistKdf;
import org.m2mrsp.protocol.crypto.RspCrypto;
import org.m2mrsp.protocol.crypto.Scp03t;
import org.m2mrsp.protocol.crypto.Scp03tChannel;
import org.m2mrsp.protocol.exception.InvalidSessionException;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.exception.ProfileNotFoundException;
import org.m2mrsp.protocol.exception.RspException;
import org.m2mrsp.protocol.exception.SignatureVerificationFailedException;
import org.m2mrsp.protocol.identity.CertificateVerifier;
import org.m2mrsp.protocol.identity.EntityIdentity;
import org.m2mrsp.protocol.model.BoundProfilePackage;
import org.m2mrsp.protocol.model.DerivedKeySet;
import org.m2mrsp.protocol.model.EntityStatus;
import org.m2mrsp.protocol.model.EphemeralKeyPair;
import org.m2mrsp.protocol.model.KeyEstablishmentOffer;
import org.m2mrsp.protocol.model.KeyEstablishmentReceipt;
import org.m2mrsp.protocol.model.KeyEstablishmentResponse;
import org.m2mrsp.protocol.model.Profile;
import org.m2mrsp.protocol.model.ProfileApplication;
import org.m2mrsp.protocol.model.ProfileContent;
import org.m2mrsp.protocol.model.ProfileSegment;
import org.m2mrsp.protocol.model.ProfileStatus;
import org.m2mrsp.protocol.model.SessionKeys;
import org.m2mrsp.protocol.model.SimData;
import org.m2mrsp.protocol.profile.ProfileCodec;
import org.m2mrsp.protocol.profile.ProfileImage;
import org.m2mrsp.server.store.KeySession;
import org.m2mrsp.server.store.SessionStep;
import org.m2mrsp.server.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscription Manager - Data Preparation.
 * <p>
 * Prepares profiles, runs the initiator side of authenticated key establishment with an eUICC
 * and binds prepared profiles into SCP03t-protected packages.
 * <p>
 * <strong>Exception contract:</strong>
 * <ul>
 *   <li>{@link InvalidSessionException} (or its expiry subtype) for unknown, expired or
 *       out-of-step sessions. No secret is stored in that case.</li>
 *   <li>{@link org.m2mrsp.protocol.exception.CertificateVerificationFailedException},
 *       {@link SignatureVerificationFailedException}, {@link MacVerificationFailedException}
 *       and {@link org.m2mrsp.protocol.exception.InvalidPublicKeyException} when the eUICC
 *       answer does not authenticate. The session is revoked before the exception propagates.</li>
 *   <li>{@link ProfileNotFoundException} for unknown ICCIDs.</li>
 * </ul>
 */
@Singleton
public class SmDp {

  private static final Logger log = LoggerFactory.getLogger(SmDp.class);

  public static final String DEFAULT_PROFILE_TYPE = "telecommunication";
  public static final String INVALID_ICCID = "ICCID must be 15 to 20 digits";

  private static final Pattern ICCID = Pattern.compile("\\d{15,20}");
  private static final int SIM_KEY_LENGTH = 16;

  private final EntityIdentity identity;
  private final CertificateVerifier certificateVerifier;
  private final Ecdh ecdh;
  private final SessionStore sessionStore;
  private final ProfileCodec profileCodec;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final int segmentSize;

  private final ConcurrentHashMap<String, Profile> profiles = new ConcurrentHashMap<>();

  /**
   * Instantiates a new SM-DP.
   *
   * @param identity            long-term identity
   * @param certificateVerifier verifier for eUICC certificates
   * @param ecdh                ECDH engine
   * @param sessionStore        key establishment sessions
   * @param profileCodec        canonical profile encoding
   * @param randomProvider      source of SIM keys
   * @param clock               time source
   * @param segmentSize         bound profile package segment size in bytes
   */
  public SmDp(EntityIdentity identity,
              CertificateVerifier certificateVerifier,
              Ecdh ecdh,
              SessionStore sessionStore,
              ProfileCodec profileCodec,
              RandomProvider randomProvider,
              Clock clock,
              int segmentSize) {
    if (segmentSize <= 0) {
      throw new IllegalArgumentException("segmentSize must be positive: " + segmentSize);
    }
    this.identity = identity;
    this.certificateVerifier = certificateVerifier;
    this.ecdh = ecdh;
    this.sessionStore = sessionStore;
    this.profileCodec = profileCodec;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.segmentSize = segmentSize;
  }

  // ── Key establishment ─────────────────────────────────────────────────────

  /**
   * Opens a key establishment session: fresh ephemeral key pair, 16-byte challenge and a
   * signature over {@code publicKey || challenge || isdpAid}.
   *
   * @param euiccId target eUICC
   * @param isdpAid target ISD-P
   * @return the offer to route to the eUICC
   */
  public KeyEstablishmentOffer initKeyEstablishment(String euiccId, String isdpAid) {
    log.debug("initKeyEstablishment({}, {})", euiccId, isdpAid);
    String sessionId = UUID.randomUUID().toString();
    EphemeralKeyPair keyPair = ecdh.generateKeyPair();
    byte[] challenge = ecdh.generateRandomChallenge();
    byte[] signature = identity.sign(
        KeyEstablishment.offerData(keyPair.publicKey(), challenge, isdpAid));
    sessionStore.store(KeySession.initialized(sessionId, identity.getName(), euiccId, isdpAid,
        keyPair, challenge, clock.instant()));
    return new KeyEstablishmentOffer(sessionId, isdpAid, keyPair.publicKey(), challenge,
        signature, identity.getCertificate());
  }

  /**
   * Completes a session with the eUICC's answer. Verifies the eUICC certificate, the receipt
   * signature and the key confirmation MAC before the session is marked COMPLETED; the
   * ephemeral private key is discarded on completion.
   *
   * @param response the eUICC answer
   * @return the derived keys
   */
  public DerivedKeySet completeKeyEstablishment(KeyEstablishmentResponse response) {
    log.debug("completeKeyEstablishment({})", response.sessionId());
    String sessionId = response.sessionId();
    KeySession session = sessionStore.require(sessionId);
    if (session.step() != SessionStep.INITIALIZED) {
      throw new InvalidSessionException("Session " + sessionId + " is already " + session.step());
    }
    try {
      X509Certificate euiccCertificate = response.certificate();
      certificateVerifier.verify(euiccCertificate);
      KeyEstablishmentReceipt receipt = response.receipt();
      if (receipt == null || !EntityIdentity.verify(receipt.signature(), receipt.mac(),
          euiccCertificate.getPublicKey())) {
        throw new SignatureVerificationFailedException("Invalid receipt signature");
      }
      byte[] cardChallenge = response.cardChallenge();
      if (cardChallenge == null || cardChallenge.length != Ecdh.CHALLENGE_LENGTH) {
        throw new MacVerificationFailedException("Card challenge must be "
            + Ecdh.CHALLENGE_LENGTH + " bytes");
      }
      byte[] sharedSecret = ecdh.computeSharedSecret(
          session.ephemeralKeyPair().privateScalar(), response.publicKey());
      DerivedKeySet keys = NistKdf.deriveKeySet(sharedSecret);
      byte[] expectedMac = KeyEstablishment.receiptMac(keys.km(), session.randomChallenge(),
          cardChallenge, response.publicKey(), session.ephemeralKeyPair().publicKey());
      if (!RspCrypto.constantTimeEquals(expectedMac, receipt.mac())) {
        throw new MacVerificationFailedException("Key confirmation failed");
      }
      SessionKeys sessionKeys = Scp03t.deriveSessionKeys(sharedSecret, identity.getName(),
          session.peerId(), session.randomChallenge(), cardChallenge);
      sessionStore.update(sessionId, current -> {
        if (current.step() != SessionStep.INITIALIZED) {
          throw new InvalidSessionException("Session " + sessionId + " completed concurrently");
        }
        return current.complete(response.publicKey(), sharedSecret, keys, sessionKeys);
      });
      log.info("Key establishment {} completed with {}", sessionId, session.peerId());
      return keys;
    } catch (InvalidSessionException e) {
      throw e;
    } catch (RspException e) {
      sessionStore.revoke(sessionId);
      log.warn("Key establishment {} failed: {}", sessionId, e.getMessage());
      throw e;
    }
  }

  /**
   * Keys of a COMPLETED session.
   *
   * @throws InvalidSessionException if the session is unknown or not completed
   */
  public DerivedKeySet derivedKeys(String sessionId) {
    KeySession session = sessionStore.require(sessionId);
    if (session.step() != SessionStep.COMPLETED) {
      throw new InvalidSessionException("Session " + sessionId + " is not completed");
    }
    return session.derivedKeys();
  }

  /**
   * Discards a session and any ephemeral material it still holds.
   */
  public void releaseSession(String sessionId) {
    sessionStore.revoke(sessionId);
  }

  // ── Profiles ──────────────────────────────────────────────────────────────

  /**
   * Prepares a profile: IMSI {@code "001" + iccid[3..15)}, random Ki and OPc, USIM and ISIM
   * applications, and the integrity hash over the canonical content.
   *
   * @param profileType profile type, e.g. {@code telecommunication}
   * @param iccid       ICCID of at least 15 digits
   * @return the prepared profile
   */
  public Profile prepareProfile(String profileType, String iccid) {
    log.debug("prepareProfile({}, {})", profileType, iccid);
    if (!isValidIccid(iccid)) {
      throw new IllegalArgumentException(INVALID_ICCID);
    }
    SimData simData = new SimData("001" + iccid.substring(3, 15),
        RspCrypto.toHex(randomProvider.randomBytes(SIM_KEY_LENGTH)),
        RspCrypto.toHex(randomProvider.randomBytes(SIM_KEY_LENGTH)));
    ProfileContent content = new ProfileContent(profileType, iccid, clock.millis(), simData,
        List.of(ProfileApplication.USIM, ProfileApplication.ISIM));
    Profile profile = new Profile(content, profileCodec.hash(content), ProfileStatus.PREPARED);
    profiles.put(iccid, profile);
    log.info("Prepared {} profile {}", profileType, iccid);
    return profile;
  }

  /**
   * Binds a prepared profile to a COMPLETED session: the canonical profile image is split into
   * segments and each is wrapped in an SCP03t INSTALL APDU for the session's ISD-P. The profile
   * status becomes {@code transmitted}.
   *
   * @param iccid     prepared profile
   * @param sessionId completed session
   * @return the bound profile package
   */
  public BoundProfilePackage bindProfile(String iccid, String sessionId) {
    log.debug("bindProfile({}, {})", iccid, sessionId);
    Profile profile = requireProfile(iccid);
    KeySession session = sessionStore.require(sessionId);
    if (session.step() != SessionStep.COMPLETED) {
      throw new InvalidSessionException("No secure channel established for " + sessionId);
    }
    byte[] image = profileCodec.encode(new ProfileImage(profile.content(), profile.integrityHash()));
    List<byte[]> slices = ProfileCodec.segment(image, segmentSize);
    Scp03tChannel channel = new Scp03tChannel(session.sessionKeys());
    List<ProfileSegment> segments = new ArrayList<>(slices.size());
    for (int i = 0; i < slices.size(); i++) {
      segments.add(new ProfileSegment(i, slices.size(),
          channel.wrapInstall(session.isdpAid(), slices.get(i))));
    }
    profiles.computeIfPresent(iccid, (k, p) -> p.withStatus(ProfileStatus.TRANSMITTED));
    log.info("Bound profile {} into {} segment(s) for ISD-P {}", iccid, segments.size(),
        session.isdpAid());
    return new BoundProfilePackage(sessionId, session.isdpAid(), iccid, List.copyOf(segments));
  }

  public static boolean isValidIccid(String iccid) {
    return iccid != null && ICCID.matcher(iccid).matches();
  }

  public Optional<Profile> findProfile(String iccid) {
    return Optional.ofNullable(profiles.get(iccid));
  }

  /**
   * @throws ProfileNotFoundException if the ICCID was never prepared
   */
  public Profile requireProfile(String iccid) {
    return findProfile(iccid).orElseThrow(
        () -> new ProfileNotFoundException("Profile not found: " + iccid));
  }

  // ── Status ────────────────────────────────────────────────────────────────

  public EntityStatus status() {
    Map<String, Object> counters = new LinkedHashMap<>();
    counters.put("profiles", profiles.size());
    counters.put("key_sessions", sessionStore.size());
    return new EntityStatus(identity.getName(), counters);
  }

  public EntityIdentity getIdentity() {
    return identity;
  }
}
