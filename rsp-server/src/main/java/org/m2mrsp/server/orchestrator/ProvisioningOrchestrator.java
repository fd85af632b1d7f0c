package org.m2mrsp.server.orchestrator;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.m2mrsp.protocol.exception.InvalidIsdpStateException;
import org.m2mrsp.protocol.exception.RspException;
import org.m2mrsp.protocol.model.BoundProfilePackage;
import org.m2mrsp.protocol.model.DerivedKeySet;
import org.m2mrsp.protocol.model.Es8Response;
import org.m2mrsp.protocol.model.EuiccInformationSet;
import org.m2mrsp.protocol.model.IsdpRecord;
import org.m2mrsp.protocol.model.KeyEstablishmentOffer;
import org.m2mrsp.protocol.model.KeyEstablishmentResponse;
import org.m2mrsp.protocol.model.Profile;
import org.m2mrsp.protocol.model.ProfileStatus;
import org.m2mrsp.protocol.model.PskEnvelope;
import org.m2mrsp.protocol.model.PskRekeyOffer;
import org.m2mrsp.protocol.model.PskRekeyResponse;
import org.m2mrsp.protocol.model.PskSegment;
import org.m2mrsp.protocol.model.SegmentAck;
import org.m2mrsp.server.entity.Euicc;
import org.m2mrsp.server.entity.SmDp;
import org.m2mrsp.server.entity.SmSr;
import org.m2mrsp.server.metrics.MetricsRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sequences the provisioning phases across SM-DP, SM-SR and an eUICC.
 * <p>
 * Every message between two entities passes through {@link SmSr#routeMessage}. A failing phase
 * raises {@link ProtocolAbortedException}; later phases do not run, the SM-DP session, if one
 * was opened, is released and a full run deletes the ISD-P it created. Phase durations go to the
 * {@link MetricsRecorder}.
 */
@Singleton
public class ProvisioningOrchestrator {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningOrchestrator.class);

  private final SmDp smDp;
  private final SmSr smSr;
  private final MetricsRecorder metrics;

  @Inject
  public ProvisioningOrchestrator(SmDp smDp, SmSr smSr, MetricsRecorder metrics) {
    this.smDp = smDp;
    this.smSr = smSr;
    this.metrics = metrics;
  }

  /**
   * Runs ISD-P creation, key establishment, profile download and enabling for one eUICC. The
   * eUICC must be registered with SM-SR.
   *
   * @param euicc          target card
   * @param memoryRequired ISD-P memory
   * @param profileType    profile type to prepare
   * @param iccid          profile ICCID
   * @return the run outcome
   * @throws ProtocolAbortedException naming the failing phase
   */
  public ProvisioningResult provision(Euicc euicc, int memoryRequired, String profileType,
                                      String iccid) {
    log.info("Provisioning {} on eUICC {}", iccid, euicc.getEuiccId());
    Map<ProtocolPhase, Duration> timings = new EnumMap<>(ProtocolPhase.class);
    String isdpAid = runPhase(ProtocolPhase.ISDP_CREATION, timings,
        () -> doCreateIsdp(euicc, memoryRequired));
    try {
      KeyEstablishmentResult keys = runPhase(ProtocolPhase.KEY_ESTABLISHMENT, timings,
          () -> doEstablishKeys(euicc, isdpAid));
      Profile profile = runPhase(ProtocolPhase.PROFILE_DOWNLOAD, timings,
          () -> doDownloadAndInstall(euicc, keys.sessionId(), isdpAid, profileType, iccid));
      ProfileStatus status = runPhase(ProtocolPhase.PROFILE_ENABLING, timings,
          () -> doEnableProfile(euicc, isdpAid));
      log.info("Provisioned {} in ISD-P {} on eUICC {}", iccid, isdpAid, euicc.getEuiccId());
      return new ProvisioningResult(euicc.getEuiccId(), isdpAid, keys.sessionId(), iccid,
          profile.integrityHash(), keys.smDpKeys(), status, Collections.unmodifiableMap(timings));
    } catch (RuntimeException e) {
      rollBackIsdp(euicc, isdpAid, e);
      throw e;
    }
  }

  // ── Individual phases ────────────────────────────────────────────────────

  /**
   * Registers the eUICC with SM-SR and installs the issued transport PSK on the card.
   */
  public void register(Euicc euicc) {
    runPhase(ProtocolPhase.REGISTRATION, null, () -> {
      EuiccInformationSet eis = route(euicc.getEuiccId(), smSrName(), euicc.informationSet());
      byte[] psk = smSr.registerEuicc(eis);
      euicc.installPsk(route(smSrName(), euicc.getEuiccId(), psk));
      return null;
    });
  }

  public String createIsdp(Euicc euicc, int memoryRequired) {
    return runPhase(ProtocolPhase.ISDP_CREATION, null, () -> doCreateIsdp(euicc, memoryRequired));
  }

  public KeyEstablishmentResult establishKeys(Euicc euicc, String isdpAid) {
    return runPhase(ProtocolPhase.KEY_ESTABLISHMENT, null, () -> doEstablishKeys(euicc, isdpAid));
  }

  /**
   * Prepares, binds, delivers and installs a profile over an established session.
   */
  public Profile downloadAndInstall(Euicc euicc, String sessionId, String isdpAid,
                                    String profileType, String iccid) {
    return runPhase(ProtocolPhase.PROFILE_DOWNLOAD, null,
        () -> doDownloadAndInstall(euicc, sessionId, isdpAid, profileType, iccid));
  }

  public ProfileStatus enableProfile(Euicc euicc, String isdpAid) {
    return runPhase(ProtocolPhase.PROFILE_ENABLING, null, () -> doEnableProfile(euicc, isdpAid));
  }

  public ProfileStatus disableProfile(Euicc euicc, String isdpAid) {
    return runPhase(ProtocolPhase.PROFILE_DISABLING, null, () -> {
      PskEnvelope command = route(smSrName(), euicc.getEuiccId(),
          smSr.disableProfileCommand(isdpAid));
      return es8RoundTrip(euicc, command).profileStatus();
    });
  }

  /**
   * Deletes an ISD-P on the card and releases its memory at SM-SR.
   */
  public void deleteIsdp(Euicc euicc, String isdpAid) {
    runPhase(ProtocolPhase.ISDP_DELETION, null, () -> {
      PskEnvelope command = route(smSrName(), euicc.getEuiccId(),
          smSr.deleteIsdpCommand(isdpAid));
      return es8RoundTrip(euicc, command);
    });
  }

  /**
   * Replaces the SM-SR / eUICC transport PSK with one agreed over ECDH.
   */
  public void rekeyTransport(Euicc euicc) {
    runPhase(ProtocolPhase.TRANSPORT_REKEY, null, () -> {
      PskRekeyOffer offer = route(smSrName(), euicc.getEuiccId(),
          smSr.initPskRekey(euicc.getEuiccId()));
      PskRekeyResponse response = route(euicc.getEuiccId(), smSrName(),
          euicc.respondToPskRekey(offer));
      byte[] confirmation = smSr.completePskRekey(response);
      euicc.confirmPskRekey(offer.sessionId(),
          route(smSrName(), euicc.getEuiccId(), confirmation));
      return null;
    });
  }

  // ── Phase bodies ─────────────────────────────────────────────────────────

  private String doCreateIsdp(Euicc euicc, int memoryRequired) {
    String euiccId = euicc.getEuiccId();
    route(smDpName(), smSrName(), euiccId);
    EuiccInformationSet eis = route(smSrName(), smDpName(), smSr.requireEuicc(euiccId));
    log.debug("eUICC {} reports {} bytes free", eis.euiccId(), eis.freeMemory());
    IsdpRecord record = smSr.createIsdp(euiccId, memoryRequired);
    try {
      es8RoundTrip(euicc, route(smSrName(), euiccId, smSr.createIsdpCommand(record)));
    } catch (RuntimeException e) {
      smSr.discardIsdp(record.isdpAid());
      throw e;
    }
    return route(smSrName(), smDpName(), record).isdpAid();
  }

  private KeyEstablishmentResult doEstablishKeys(Euicc euicc, String isdpAid) {
    KeyEstablishmentOffer offer = route(smDpName(), euicc.getEuiccId(),
        smDp.initKeyEstablishment(euicc.getEuiccId(), isdpAid));
    try {
      KeyEstablishmentResponse response = route(euicc.getEuiccId(), smDpName(),
          euicc.respondToKeyEstablishment(offer));
      DerivedKeySet smDpKeys = smDp.completeKeyEstablishment(response);
      return new KeyEstablishmentResult(offer.sessionId(), isdpAid, smDpKeys,
          euicc.derivedKeys(offer.sessionId()));
    } catch (RuntimeException e) {
      smDp.releaseSession(offer.sessionId());
      throw e;
    }
  }

  private Profile doDownloadAndInstall(Euicc euicc, String sessionId, String isdpAid,
                                       String profileType, String iccid) {
    try {
      Profile profile = smDp.prepareProfile(profileType, iccid);
      BoundProfilePackage boundPackage = route(smDpName(), smSrName(),
          smDp.bindProfile(iccid, sessionId));
      smSr.receiveProfile(boundPackage);
      for (PskSegment segment : smSr.deliverProfile(isdpAid)) {
        SegmentAck ack = euicc.receiveSegment(route(smSrName(), euicc.getEuiccId(), segment));
        smSr.acknowledgeSegment(route(euicc.getEuiccId(), smSrName(), ack));
      }
      if (euicc.profileStatus(iccid).orElse(null) != ProfileStatus.INSTALLED) {
        throw new InvalidIsdpStateException("Profile " + iccid + " was not installed");
      }
      return profile;
    } catch (RuntimeException e) {
      smDp.releaseSession(sessionId);
      throw e;
    }
  }

  private ProfileStatus doEnableProfile(Euicc euicc, String isdpAid) {
    PskEnvelope command = route(smSrName(), euicc.getEuiccId(),
        smSr.enableProfileCommand(isdpAid));
    return es8RoundTrip(euicc, command).profileStatus();
  }

  /**
   * Deletes the ISD-P of a failed run on the card and at SM-SR. A failure here is attached to the
   * original error rather than replacing it.
   */
  private void rollBackIsdp(Euicc euicc, String isdpAid, RuntimeException failure) {
    log.info("Rolling back ISD-P {} on eUICC {}", isdpAid, euicc.getEuiccId());
    try {
      es8RoundTrip(euicc, route(smSrName(), euicc.getEuiccId(), smSr.deleteIsdpCommand(isdpAid)));
    } catch (RuntimeException e) {
      log.warn("Rollback of ISD-P {} failed: {}", isdpAid, e.getMessage());
      smSr.discardIsdp(isdpAid);
      failure.addSuppressed(e);
    }
  }

  private Es8Response es8RoundTrip(Euicc euicc, PskEnvelope command) {
    PskEnvelope response = route(euicc.getEuiccId(), smSrName(), euicc.handleEs8(command));
    return smSr.processEs8Response(euicc.getEuiccId(), response);
  }

  // ── Plumbing ─────────────────────────────────────────────────────────────

  private <T> T runPhase(ProtocolPhase phase, Map<ProtocolPhase, Duration> timings,
                         Supplier<T> body) {
    log.debug("Phase {} started", phase);
    long start = System.nanoTime();
    try {
      return body.get();
    } catch (RspException e) {
      log.warn("Phase {} aborted: {} ({})", phase, e.getMessage(), e.getErrorKind());
      throw new ProtocolAbortedException(phase, e);
    } finally {
      Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
      metrics.recordDuration(phase.metricName(), elapsed);
      if (timings != null) {
        timings.put(phase, elapsed);
      }
    }
  }

  private <T> T route(String source, String destination, T message) {
    return smSr.routeMessage(source, destination, message);
  }

  private String smDpName() {
    return smDp.getIdentity().getName();
  }

  private String smSrName() {
    return smSr.getIdentity().getName();
  }
}
