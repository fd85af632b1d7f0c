package org.m2mrsp.server.entity;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import javax.inject.Singleton;
import org.m2mrsp.protocol.RandomProvider;
import org.m2mrsp.protocol.crypto.Ecdh;
import org.m2mrsp.protocol.crypto.KeyEstablishment;
import org.m2mrsp.protocol.crypto.PskCipher;
import org.m2mrsp.protocol.exception.EuiccNotRegisteredException;
import org.m2mrsp.protocol.exception.InvalidIsdpStateException;
import org.m2mrsp.protocol.exception.InvalidSessionException;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.exception.ProfileNotFoundException;
import org.m2mrsp.protocol.exception.RspException;
import org.m2mrsp.protocol.exception.SignatureVerificationFailedException;
import org.m2mrsp.protocol.identity.CertificateVerifier;
import org.m2mrsp.protocol.identity.EntityIdentity;
import org.m2mrsp.protocol.isdp.IsdpLifecycleManager;
import org.m2mrsp.protocol.model.BoundProfilePackage;
import org.m2mrsp.protocol.model.EntityStatus;
import org.m2mrsp.protocol.model.EphemeralKeyPair;
import org.m2mrsp.protocol.model.Es8Command;
import org.m2mrsp.protocol.model.Es8CommandType;
import org.m2mrsp.protocol.model.Es8Response;
import org.m2mrsp.protocol.model.EuiccInformationSet;
import org.m2mrsp.protocol.model.IsdpRecord;
import org.m2mrsp.protocol.model.IsdpState;
import org.m2mrsp.protocol.model.ProfileSegment;
import org.m2mrsp.protocol.model.PskEnvelope;
import org.m2mrsp.protocol.model.PskOrigin;
import org.m2mrsp.protocol.model.PskRecord;
import org.m2mrsp.protocol.model.PskRekeyOffer;
import org.m2mrsp.protocol.model.PskRekeyResponse;
import org.m2mrsp.protocol.model.PskSegment;
import org.m2mrsp.protocol.model.SegmentAck;
import org.m2mrsp.server.metrics.MetricsRecorder;
import org.m2mrsp.server.store.KeySession;
import org.m2mrsp.server.store.PskStore;
import org.m2mrsp.server.store.SessionStep;
import org.m2mrsp.server.store.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Subscription Manager - Secure Routing.
 * <p>
 * Keeps the eUICC registry (information sets and transport PSKs), owns the ISD-P lifecycle
 * records, relays every SM-DP / eUICC message and protects its own traffic to the eUICC with the
 * PSK transport cipher.
 * <p>
 * Bound profile packages are stored and forwarded: SM-SR cannot read them (they are SCP03t
 * protected end to end) and only adds the PSK layer on delivery.
 */
@Singleton
public class SmSr {

  private static final Logger log = LoggerFactory.getLogger(SmSr.class);

  public static final int DEFAULT_REGISTRATION_PSK_LENGTH = 16;

  private final EntityIdentity identity;
  private final CertificateVerifier certificateVerifier;
  private final IsdpLifecycleManager isdpManager;
  private final PskStore pskStore;
  private final PskCipher pskCipher;
  private final Ecdh ecdh;
  private final SessionStore rekeySessions;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final MetricsRecorder metrics;
  private final int registrationPskLength;

  private final ConcurrentHashMap<String, EuiccInformationSet> registry = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, BoundProfilePackage> packages = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Set<Integer>> acknowledged = new ConcurrentHashMap<>();
  private final ConcurrentHashMap<String, Es8CommandType> outstandingCommands =
      new ConcurrentHashMap<>();

  /**
   * Instantiates a new SM-SR.
   *
   * @param identity              long-term identity
   * @param certificateVerifier   verifier for eUICC certificates
   * @param isdpManager           ISD-P lifecycle records
   * @param pskStore              transport PSK registry
   * @param pskCipher             transport cipher
   * @param ecdh                  ECDH engine for PSK re-keying
   * @param rekeySessions         PSK re-keying sessions
   * @param randomProvider        source of registration PSKs
   * @param clock                 time source
   * @param metrics               timing sink
   * @param registrationPskLength 16 or 32
   */
  public SmSr(EntityIdentity identity,
              CertificateVerifier certificateVerifier,
              IsdpLifecycleManager isdpManager,
              PskStore pskStore,
              PskCipher pskCipher,
              Ecdh ecdh,
              SessionStore rekeySessions,
              RandomProvider randomProvider,
              Clock clock,
              MetricsRecorder metrics,
              int registrationPskLength) {
    PskCipher.keyType(new byte[registrationPskLength]);
    this.identity = identity;
    this.certificateVerifier = certificateVerifier;
    this.isdpManager = isdpManager;
    this.pskStore = pskStore;
    this.pskCipher = pskCipher;
    this.ecdh = ecdh;
    this.rekeySessions = rekeySessions;
    this.randomProvider = randomProvider;
    this.clock = clock;
    this.metrics = metrics;
    this.registrationPskLength = registrationPskLength;
  }

  // ── Registration ──────────────────────────────────────────────────────────

  /**
   * Registers an eUICC and issues its initial transport PSK.
   *
   * @param eis the eUICC information set
   * @return the PSK to provision on the eUICC
   * @throws IllegalArgumentException if the eUICC does not support PSK transport
   */
  public byte[] registerEuicc(EuiccInformationSet eis) {
    log.debug("registerEuicc({})", eis.euiccId());
    if (eis.capabilities() == null || !eis.capabilities().pskSupport()) {
      throw new IllegalArgumentException("eUICC " + eis.euiccId() + " does not support PSK");
    }
    certificateVerifier.verify(eis.certificate());
    byte[] psk = randomProvider.randomBytes(registrationPskLength);
    registry.put(eis.euiccId(), eis);
    isdpManager.registerEuicc(eis.euiccId(), eis.freeMemory());
    pskStore.put(new PskRecord(eis.euiccId(), psk, clock.instant(), PskOrigin.REGISTRATION));
    log.info("Registered eUICC {} ({} bytes free)", eis.euiccId(), eis.freeMemory());
    return psk;
  }

  public Optional<EuiccInformationSet> lookupEuicc(String euiccId) {
    return Optional.ofNullable(registry.get(euiccId));
  }

  /**
   * @throws EuiccNotRegisteredException if the eUICC is unknown
   */
  public EuiccInformationSet requireEuicc(String euiccId) {
    return lookupEuicc(euiccId).orElseThrow(
        () -> new EuiccNotRegisteredException("eUICC not registered: " + euiccId));
  }

  // ── Transport PSK re-keying ──────────────────────────────────────────────

  /**
   * Opens an ECDH exchange that will replace the eUICC's transport PSK.
   */
  public PskRekeyOffer initPskRekey(String euiccId) {
    log.debug("initPskRekey({})", euiccId);
    requireEuicc(euiccId);
    String sessionId = UUID.randomUUID().toString();
    EphemeralKeyPair keyPair = ecdh.generateKeyPair();
    byte[] challenge = ecdh.generateRandomChallenge();
    byte[] signature = identity.sign(
        KeyEstablishment.offerData(keyPair.publicKey(), challenge, euiccId));
    rekeySessions.store(KeySession.initialized(sessionId, identity.getName(), euiccId, null,
        keyPair, challenge, clock.instant()));
    return new PskRekeyOffer(sessionId, euiccId, keyPair.publicKey(), challenge, signature,
        identity.getCertificate());
  }

  /**
   * Verifies the eUICC answer, replaces the PSK with the ECDH-derived 32-byte key and returns
   * the confirmation the eUICC needs before switching.
   */
  public byte[] completePskRekey(PskRekeyResponse response) {
    log.debug("completePskRekey({})", response.sessionId());
    KeySession session = rekeySessions.require(response.sessionId());
    if (session.step() != SessionStep.INITIALIZED) {
      throw new InvalidSessionException("Session " + response.sessionId() + " already used");
    }
    try {
      certificateVerifier.verify(response.certificate());
      byte[] signed = KeyEstablishment.offerData(response.publicKey(), session.randomChallenge(),
          session.peerId());
      if (!EntityIdentity.verify(response.signature(), signed,
          response.certificate().getPublicKey())) {
        throw new SignatureVerificationFailedException("Invalid eUICC re-key signature");
      }
      byte[] shared = ecdh.computeSharedSecret(session.ephemeralKeyPair().privateScalar(),
          response.publicKey());
      byte[] psk = KeyEstablishment.establishedPsk(shared, session.randomChallenge(),
          session.peerId());
      pskStore.put(new PskRecord(session.peerId(), psk, clock.instant(),
          PskOrigin.KEY_ESTABLISHMENT));
      log.info("Replaced transport PSK of {} through key establishment", session.peerId());
      return KeyEstablishment.pskConfirmation(psk, response.sessionId());
    } finally {
      rekeySessions.revoke(response.sessionId());
    }
  }

  // ── ISD-P management ─────────────────────────────────────────────────────

  /**
   * Allocates an ISD-P for a registered eUICC.
   */
  public IsdpRecord createIsdp(String euiccId, int memoryRequired) {
    log.debug("createIsdp({}, {})", euiccId, memoryRequired);
    requireEuicc(euiccId);
    return isdpManager.create(euiccId, memoryRequired);
  }

  /**
   * Drops an ISD-P the eUICC refused to create, returning its memory.
   */
  public void discardIsdp(String isdpAid) {
    isdpManager.find(isdpAid)
        .filter(r -> r.state() != IsdpState.DELETED)
        .ifPresent(r -> isdpManager.delete(isdpAid));
    outstandingCommands.remove(isdpAid);
    dropPackage(isdpAid);
  }

  private void dropPackage(String isdpAid) {
    packages.remove(isdpAid);
    acknowledged.remove(isdpAid);
  }

  public IsdpRecord isdp(String isdpAid) {
    return isdpManager.require(isdpAid);
  }

  // ── ES8 ──────────────────────────────────────────────────────────────────

  public PskEnvelope createIsdpCommand(IsdpRecord record) {
    return protect(record.euiccId(), new Es8Command(Es8CommandType.CREATE_ISDP,
        record.isdpAid(), record.memoryAllocated(), null, clock.millis()));
  }

  public PskEnvelope enableProfileCommand(String isdpAid) {
    IsdpRecord record = isdpManager.require(isdpAid);
    if (record.iccid() == null) {
      throw new ProfileNotFoundException("No profile installed in ISD-P " + isdpAid);
    }
    return protect(record.euiccId(), new Es8Command(Es8CommandType.ENABLE_PROFILE, isdpAid,
        null, record.iccid(), clock.millis()));
  }

  public PskEnvelope disableProfileCommand(String isdpAid) {
    IsdpRecord record = isdpManager.require(isdpAid);
    return protect(record.euiccId(), new Es8Command(Es8CommandType.DISABLE_PROFILE, isdpAid,
        null, record.iccid(), clock.millis()));
  }

  public PskEnvelope deleteIsdpCommand(String isdpAid) {
    IsdpRecord record = isdpManager.require(isdpAid);
    return protect(record.euiccId(), new Es8Command(Es8CommandType.DELETE_ISDP, isdpAid,
        null, record.iccid(), clock.millis()));
  }

  private PskEnvelope protect(String euiccId, Es8Command command) {
    log.debug("ES8 {} -> {}", command.command(), euiccId);
    PskEnvelope envelope = pskCipher.encryptObject(command, pskStore.require(euiccId).psk());
    outstandingCommands.put(command.isdpAid(), command.command());
    return envelope;
  }

  /**
   * Decrypts an ES8 response and applies it to the ISD-P record. The response must name an ISD-P
   * of the answering eUICC and answer the command last sent for that ISD-P.
   *
   * @throws MacVerificationFailedException if the response is not bound to this eUICC or to an
   *                                        outstanding command
   */
  public Es8Response processEs8Response(String euiccId, PskEnvelope envelope) {
    Es8Response response = pskCipher.decryptObject(envelope, pskStore.require(euiccId).psk(),
        Es8Response.class);
    String owner = isdpManager.find(response.isdpAid()).map(IsdpRecord::euiccId).orElse(null);
    if (!euiccId.equals(owner)) {
      throw new MacVerificationFailedException("ES8 response names ISD-P " + response.isdpAid()
          + " which does not belong to eUICC " + euiccId);
    }
    if (!outstandingCommands.remove(response.isdpAid(), response.command())) {
      throw new MacVerificationFailedException("Unsolicited ES8 " + response.command()
          + " response for ISD-P " + response.isdpAid());
    }
    if (!Es8Response.SUCCESS.equals(response.status())) {
      throw new InvalidIsdpStateException("eUICC rejected " + response.command());
    }
    switch (response.command()) {
      case ENABLE_PROFILE -> isdpManager.enable(response.isdpAid());
      case DISABLE_PROFILE -> isdpManager.disable(response.isdpAid());
      case DELETE_ISDP -> {
        isdpManager.delete(response.isdpAid());
        dropPackage(response.isdpAid());
      }
      case CREATE_ISDP -> log.debug("eUICC {} confirmed ISD-P {}", euiccId, response.isdpAid());
      default -> throw new IllegalStateException("Unhandled ES8 command " + response.command());
    }
    return response;
  }

  // ── Profile download ─────────────────────────────────────────────────────

  /**
   * Stores a bound profile package for its ISD-P.
   */
  public void receiveProfile(BoundProfilePackage boundPackage) {
    log.debug("receiveProfile({}, {})", boundPackage.isdpAid(), boundPackage.iccid());
    IsdpRecord record = isdpManager.require(boundPackage.isdpAid());
    if (record.state() != IsdpState.CREATED) {
      throw new InvalidIsdpStateException("ISD-P " + record.isdpAid() + " is " + record.state());
    }
    packages.put(boundPackage.isdpAid(), boundPackage);
    acknowledged.put(boundPackage.isdpAid(), ConcurrentHashMap.newKeySet());
  }

  /**
   * Wraps every segment of the stored package in the eUICC's PSK.
   */
  public List<PskSegment> deliverProfile(String isdpAid) {
    BoundProfilePackage boundPackage = packages.get(isdpAid);
    if (boundPackage == null) {
      throw new ProfileNotFoundException("No profile package for ISD-P " + isdpAid);
    }
    byte[] psk = pskStore.require(isdpManager.require(isdpAid).euiccId()).psk();
    List<PskSegment> delivered = new ArrayList<>(boundPackage.segments().size());
    for (ProfileSegment segment : boundPackage.segments()) {
      delivered.add(new PskSegment(isdpAid, segment.index(), segment.total(),
          pskCipher.encrypt(segment.apdu(), psk)));
    }
    return delivered;
  }

  /**
   * Records a segment acknowledgement. When every segment has been acknowledged the ISD-P
   * becomes UPLOADED; a completing acknowledgement installs the profile.
   */
  public void acknowledgeSegment(SegmentAck ack) {
    BoundProfilePackage boundPackage = packages.get(ack.isdpAid());
    Set<Integer> acks = acknowledged.get(ack.isdpAid());
    if (boundPackage == null || acks == null) {
      throw new ProfileNotFoundException("No profile package for ISD-P " + ack.isdpAid());
    }
    int total = boundPackage.segments().size();
    if (ack.index() < 0 || ack.index() >= total) {
      throw new IllegalArgumentException("Segment index out of range: " + ack.index());
    }
    acks.add(ack.index());
    if (acks.size() == total && isdpManager.require(ack.isdpAid()).state() == IsdpState.CREATED) {
      isdpManager.upload(ack.isdpAid());
    }
    if (ack.complete()) {
      if (acks.size() != total) {
        throw new InvalidIsdpStateException("Install reported before all segments arrived");
      }
      isdpManager.install(ack.isdpAid(), boundPackage.iccid());
      packages.remove(ack.isdpAid());
      acknowledged.remove(ack.isdpAid());
      log.info("Profile {} installed in ISD-P {}", boundPackage.iccid(), ack.isdpAid());
    }
  }

  // ── Routing ──────────────────────────────────────────────────────────────

  /**
   * Forwards a message between entities unchanged and times the hop.
   */
  public <T> T routeMessage(String source, String destination, T message) {
    return metrics.time("route_message", () -> {
      log.debug("route {} -> {}: {}", source, destination, message.getClass().getSimpleName());
      return message;
    });
  }

  // ── Status ────────────────────────────────────────────────────────────────

  public EntityStatus status() {
    Map<String, Object> counters = new LinkedHashMap<>();
    counters.put("profiles", packages.size());
    counters.put("euiccs", registry.size());
    counters.put("isdps", isdpManager.count());
    counters.put("sm_sr_id", identity.getName());
    return new EntityStatus(identity.getName(), counters);
  }

  public int registeredEuiccs() {
    return registry.size();
  }

  public int establishedPsks() {
    return pskStore.size();
  }

  public EntityIdentity getIdentity() {
    return identity;
  }
}
