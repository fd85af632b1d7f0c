package org.m2mrsp.server.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;

import java.time.Clock;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.m2mrsp.protocol.RandomProvider;
import org.m2mrsp.protocol.crypto.Ecdh;
import org.m2mrsp.protocol.crypto.KeyEstablishment;
import org.m2mrsp.protocol.crypto.NistKdf;
import org.m2mrsp.protocol.crypto.Scp03t;
import org.m2mrsp.protocol.crypto.Scp03tChannel;
import org.m2mrsp.protocol.exception.CertificateVerificationFailedException;
import org.m2mrsp.protocol.exception.InvalidSessionException;
import org.m2mrsp.protocol.exception.MacVerificationFailedException;
import org.m2mrsp.protocol.exception.ProfileNotFoundException;
import org.m2mrsp.protocol.exception.SignatureVerificationFailedException;
import org.m2mrsp.protocol.identity.CertificateVerifier;
import org.m2mrsp.protocol.identity.EntityIdentity;
import org.m2mrsp.protocol.model.BoundProfilePackage;
import org.m2mrsp.protocol.model.DerivedKeySet;
import org.m2mrsp.protocol.model.EphemeralKeyPair;
import org.m2mrsp.protocol.model.KeyEstablishmentOffer;
import org.m2mrsp.protocol.model.KeyEstablishmentReceipt;
import org.m2mrsp.protocol.model.KeyEstablishmentResponse;
import org.m2mrsp.protocol.model.Profile;
import org.m2mrsp.protocol.model.ProfileApplication;
import org.m2mrsp.protocol.model.ProfileSegment;
import org.m2mrsp.protocol.model.ProfileStatus;
import org.m2mrsp.protocol.model.SessionKeys;
import org.m2mrsp.protocol.profile.ProfileCodec;
import org.m2mrsp.protocol.profile.ProfileImage;
import org.m2mrsp.server.RspTestFixture;
import org.m2mrsp.server.store.InMemorySessionStore;
import org.m2mrsp.server.store.KeySession;
import org.m2mrsp.server.store.SessionStep;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Tests for {@link SmDp}. The eUICC side of the exchange is computed directly from the protocol
 * primitives so each check can be broken independently.
 */
@ExtendWith(MockitoExtension.class)
class SmDpTest {

  private static final String AID = "A0000005591010AABBCCDD";

  @Mock private CertificateVerifier certificateVerifier;

  private final Ecdh ecdh = new Ecdh();
  private final ProfileCodec codec = new ProfileCodec();
  private final EntityIdentity euiccIdentity =
      EntityIdentity.issuedBy(RspTestFixture.EUICC_ID, RspTestFixture.rootCa());

  private InMemorySessionStore sessions;
  private SmDp smDp;

  @BeforeEach
  void setUp() {
    sessions = new InMemorySessionStore(InMemorySessionStore.DEFAULT_TTL, Clock.systemUTC(),
        false);
    smDp = new SmDp(RspTestFixture.smDpIdentity(), certificateVerifier, ecdh, sessions, codec,
        new RandomProvider(), Clock.systemUTC(), 64);
  }

  /** What a well-behaved eUICC answers, plus the keys it derived. */
  private record CardAnswer(KeyEstablishmentResponse response, DerivedKeySet keys,
                            byte[] sharedSecret) {
  }

  private CardAnswer answer(KeyEstablishmentOffer offer, boolean corruptMac) {
    EphemeralKeyPair card = ecdh.generateKeyPair();
    byte[] shared = ecdh.computeSharedSecret(card.privateScalar(), offer.publicKey());
    DerivedKeySet keys = NistKdf.deriveKeySet(shared);
    byte[] cardChallenge = ecdh.generateRandomChallenge();
    byte[] mac = KeyEstablishment.receiptMac(keys.km(), offer.randomChallenge(), cardChallenge,
        card.publicKey(), offer.publicKey());
    if (corruptMac) {
      mac[0] ^= 0x01;
    }
    KeyEstablishmentReceipt receipt = new KeyEstablishmentReceipt(mac, euiccIdentity.sign(mac));
    return new CardAnswer(new KeyEstablishmentResponse(offer.sessionId(), card.publicKey(),
        cardChallenge, receipt, euiccIdentity.getCertificate()), keys, shared);
  }

  @Test
  void initKeyEstablishment_signsOfferAndStoresInitializedSession() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);

    byte[] signed = KeyEstablishment.offerData(offer.publicKey(), offer.randomChallenge(), AID);
    assertThat(EntityIdentity.verify(offer.signature(), signed,
        offer.certificate().getPublicKey())).isTrue();
    assertThat(offer.randomChallenge()).hasSize(Ecdh.CHALLENGE_LENGTH);
    KeySession session = sessions.require(offer.sessionId());
    assertThat(session.step()).isEqualTo(SessionStep.INITIALIZED);
    assertThat(session.isdpAid()).isEqualTo(AID);
  }

  @Test
  void completeKeyEstablishment_matchesCardKeysAndDropsEphemeralKey() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);
    CardAnswer answer = answer(offer, false);

    DerivedKeySet keys = smDp.completeKeyEstablishment(answer.response());

    assertThat(keys).isEqualTo(answer.keys());
    KeySession session = sessions.require(offer.sessionId());
    assertThat(session.step()).isEqualTo(SessionStep.COMPLETED);
    assertThat(session.ephemeralKeyPair()).isNull();
    assertThat(smDp.derivedKeys(offer.sessionId())).isEqualTo(keys);
  }

  @Test
  void completeKeyEstablishment_unknownSession_throwsAndStoresNothing() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);
    KeyEstablishmentResponse real = answer(offer, false).response();
    KeyEstablishmentResponse forged = new KeyEstablishmentResponse("no-such-session",
        real.publicKey(), real.cardChallenge(), real.receipt(), real.certificate());

    assertThatThrownBy(() -> smDp.completeKeyEstablishment(forged))
        .isInstanceOf(InvalidSessionException.class);
    assertThat(sessions.load("no-such-session")).isEmpty();
    assertThat(sessions.require(offer.sessionId()).sharedSecret()).isNull();
  }

  @Test
  void completeKeyEstablishment_twice_throwsInvalidSession() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);
    KeyEstablishmentResponse response = answer(offer, false).response();
    smDp.completeKeyEstablishment(response);

    assertThatThrownBy(() -> smDp.completeKeyEstablishment(response))
        .isInstanceOf(InvalidSessionException.class);
    assertThat(sessions.require(offer.sessionId()).step()).isEqualTo(SessionStep.COMPLETED);
  }

  @Test
  void completeKeyEstablishment_wrongReceiptMac_revokesSession() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);
    KeyEstablishmentResponse response = answer(offer, true).response();

    assertThatThrownBy(() -> smDp.completeKeyEstablishment(response))
        .isInstanceOf(MacVerificationFailedException.class);
    assertThat(sessions.load(offer.sessionId())).isEmpty();
  }

  @Test
  void completeKeyEstablishment_receiptSignedByOtherKey_throwsSignatureFailure() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);
    KeyEstablishmentResponse real = answer(offer, false).response();
    EntityIdentity impostor = EntityIdentity.selfSigned("impostor");
    KeyEstablishmentReceipt receipt = new KeyEstablishmentReceipt(real.receipt().mac(),
        impostor.sign(real.receipt().mac()));
    KeyEstablishmentResponse response = new KeyEstablishmentResponse(real.sessionId(),
        real.publicKey(), real.cardChallenge(), receipt, real.certificate());

    assertThatThrownBy(() -> smDp.completeKeyEstablishment(response))
        .isInstanceOf(SignatureVerificationFailedException.class);
    assertThat(sessions.load(offer.sessionId())).isEmpty();
  }

  @Test
  void completeKeyEstablishment_untrustedCertificate_revokesSession() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);
    KeyEstablishmentResponse response = answer(offer, false).response();
    doThrow(new CertificateVerificationFailedException("untrusted"))
        .when(certificateVerifier).verify(any());

    assertThatThrownBy(() -> smDp.completeKeyEstablishment(response))
        .isInstanceOf(CertificateVerificationFailedException.class);
    assertThat(sessions.load(offer.sessionId())).isEmpty();
  }

  @Test
  void derivedKeys_beforeCompletion_throwsInvalidSession() {
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);

    assertThatThrownBy(() -> smDp.derivedKeys(offer.sessionId()))
        .isInstanceOf(InvalidSessionException.class);
  }

  @Test
  void prepareProfile_buildsSimDataApplicationsAndHash() {
    Profile profile = smDp.prepareProfile(SmDp.DEFAULT_PROFILE_TYPE, RspTestFixture.ICCID);

    assertThat(profile.status()).isEqualTo(ProfileStatus.PREPARED);
    assertThat(profile.content().simData().imsi()).isEqualTo("001123456789012");
    assertThat(profile.content().simData().ki()).matches("[0-9a-f]{32}");
    assertThat(profile.content().applications())
        .containsExactly(ProfileApplication.USIM, ProfileApplication.ISIM);
    assertThat(profile.integrityHash()).isEqualTo(codec.hash(profile.content()));
    assertThat(smDp.requireProfile(RspTestFixture.ICCID)).isEqualTo(profile);
  }

  @Test
  void prepareProfile_shortIccid_throws() {
    assertThatThrownBy(() -> smDp.prepareProfile(SmDp.DEFAULT_PROFILE_TYPE, "12345"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void requireProfile_unknown_throwsProfileNotFound() {
    assertThatThrownBy(() -> smDp.requireProfile("0000000000000000000"))
        .isInstanceOf(ProfileNotFoundException.class);
  }

  @Test
  void bindProfile_withoutCompletedSession_throwsInvalidSession() {
    smDp.prepareProfile(SmDp.DEFAULT_PROFILE_TYPE, RspTestFixture.ICCID);
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);

    assertThatThrownBy(() -> smDp.bindProfile(RspTestFixture.ICCID, offer.sessionId()))
        .isInstanceOf(InvalidSessionException.class);
  }

  /**
   * Segments unwrap in order with the card's view of the SCP03t keys and reassemble into the
   * verified profile image.
   */
  @Test
  void bindProfile_segmentsUnwrapWithCardKeys() {
    Profile profile = smDp.prepareProfile(SmDp.DEFAULT_PROFILE_TYPE, RspTestFixture.ICCID);
    KeyEstablishmentOffer offer = smDp.initKeyEstablishment(RspTestFixture.EUICC_ID, AID);
    CardAnswer answer = answer(offer, false);
    smDp.completeKeyEstablishment(answer.response());
    SessionKeys cardKeys = Scp03t.deriveSessionKeys(answer.sharedSecret(),
        RspTestFixture.smDpIdentity().getName(), RspTestFixture.EUICC_ID,
        offer.randomChallenge(), answer.response().cardChallenge());

    BoundProfilePackage bpp = smDp.bindProfile(RspTestFixture.ICCID, offer.sessionId());

    assertThat(bpp.segments()).hasSizeGreaterThan(1);
    assertThat(bpp.isdpAid()).isEqualTo(AID);
    Scp03tChannel channel = new Scp03tChannel(cardKeys);
    List<byte[]> slices = bpp.segments().stream()
        .map(ProfileSegment::apdu)
        .map(apdu -> channel.unwrapInstall(AID, apdu))
        .toList();
    ProfileImage image = codec.decodeVerified(ProfileCodec.reassemble(slices));
    assertThat(image.hash()).isEqualTo(profile.integrityHash());
    assertThat(smDp.requireProfile(RspTestFixture.ICCID).status())
        .isEqualTo(ProfileStatus.TRANSMITTED);
  }
}
