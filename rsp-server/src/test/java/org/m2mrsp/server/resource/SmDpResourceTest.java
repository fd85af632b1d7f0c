package org.m2mrsp.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.m2mrsp.model.KeyEstablishmentCompleteRequest;
import org.m2mrsp.model.KeyEstablishmentCompleteResponse;
import org.m2mrsp.model.KeyEstablishmentInitRequest;
import org.m2mrsp.model.KeyEstablishmentInitResponse;
import org.m2mrsp.model.ProfilePrepareRequest;
import org.m2mrsp.model.ProfilePrepareResponse;
import org.m2mrsp.model.StatusResponse;
import org.m2mrsp.protocol.exception.InvalidSessionException;
import org.m2mrsp.server.RspTestFixture;
import org.m2mrsp.server.entity.Euicc;
import org.m2mrsp.server.entity.EuiccDirectory;
import org.m2mrsp.server.entity.SmDp;
import org.m2mrsp.server.metrics.NoOpMetricsRecorder;
import org.m2mrsp.server.orchestrator.KeyEstablishmentResult;
import org.m2mrsp.server.orchestrator.ProvisioningOrchestrator;
import org.mockito.Mockito;

class SmDpResourceTest {

  private RspTestFixture fixture;
  private Euicc euicc;
  private String isdpAid;
  private SmDpResource resource;
  private EuiccResource euiccResource;

  @BeforeAll
  static void installRuntimeDelegate() {
    // WebApplicationException needs a RuntimeDelegate; only the API jar is on the test path.
    RuntimeDelegate mockRd = mock(RuntimeDelegate.class);
    Response.ResponseBuilder mockBuilder = mock(Response.ResponseBuilder.class, Mockito.RETURNS_SELF);
    Response mock400 = mock(Response.class);

    when(mockRd.createResponseBuilder()).thenReturn(mockBuilder);
    when(mockBuilder.status(anyInt(), anyString())).thenReturn(mockBuilder);
    when(mockBuilder.build()).thenReturn(mock400);
    when(mock400.getStatus()).thenReturn(Response.Status.BAD_REQUEST.getStatusCode());

    RuntimeDelegate.setInstance(mockRd);
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    RuntimeDelegate.setInstance(null);
  }

  @BeforeEach
  void setUp() {
    fixture = new RspTestFixture();
    ProvisioningOrchestrator orchestrator =
        fixture.orchestrator(fixture.smSr, new NoOpMetricsRecorder());
    euicc = fixture.newEuicc(RspTestFixture.EUICC_ID, RspTestFixture.EUICC_FREE_MEMORY);
    orchestrator.register(euicc);
    isdpAid = orchestrator.createIsdp(euicc, RspTestFixture.MEMORY);
    EuiccDirectory directory = new EuiccDirectory();
    directory.add(euicc);
    resource = new SmDpResource(fixture.smDp);
    euiccResource = new EuiccResource(directory);
  }

  @Test
  void keyEstablishment_overTheWire_bothSidesDeriveTheSameKeys() {
    KeyEstablishmentInitResponse offer = resource.initKeyEstablishment(
        new KeyEstablishmentInitRequest(RspTestFixture.EUICC_ID, isdpAid));
    KeyEstablishmentCompleteRequest answer =
        euiccResource.respondToKeyEstablishment(RspTestFixture.EUICC_ID, offer);

    KeyEstablishmentCompleteResponse response = resource.completeKeyEstablishment(answer);

    assertThat(response.status()).isEqualTo("success");
    assertThat(response.sessionId()).isEqualTo(offer.sessionId());
    assertThat(new KeyEstablishmentResult(offer.sessionId(), isdpAid,
        fixture.smDp.derivedKeys(offer.sessionId()), euicc.derivedKeys(offer.sessionId()))
        .keysMatch()).isTrue();
  }

  @Test
  void completeKeyEstablishment_unknownSession_throwsInvalidSession() {
    KeyEstablishmentInitResponse offer = resource.initKeyEstablishment(
        new KeyEstablishmentInitRequest(RspTestFixture.EUICC_ID, isdpAid));
    KeyEstablishmentCompleteRequest answer =
        euiccResource.respondToKeyEstablishment(RspTestFixture.EUICC_ID, offer);
    KeyEstablishmentCompleteRequest forged = new KeyEstablishmentCompleteRequest("no-such-session",
        answer.publicKey(), answer.cardChallenge(), answer.receipt(), answer.certificate());

    assertThatThrownBy(() -> resource.completeKeyEstablishment(forged))
        .isInstanceOf(InvalidSessionException.class);
  }

  @Test
  void initKeyEstablishment_missingEuiccId_throwsBadRequest() {
    assertBadRequest(() -> resource.initKeyEstablishment(
        new KeyEstablishmentInitRequest(" ", isdpAid)));
  }

  @Test
  void completeKeyEstablishment_missingReceipt_throwsBadRequest() {
    assertBadRequest(() -> resource.completeKeyEstablishment(
        new KeyEstablishmentCompleteRequest("session", null, null, null, null)));
  }

  @Test
  void prepareProfile_withoutType_usesTelecommunication() {
    ProfilePrepareResponse response = resource.prepareProfile(
        new ProfilePrepareRequest(null, RspTestFixture.ICCID));

    assertThat(response.profileType()).isEqualTo(SmDp.DEFAULT_PROFILE_TYPE);
    assertThat(response.profileStatus()).isEqualTo("prepared");
    assertThat(response.integrityHash()).hasSize(64);
  }

  @Test
  void prepareProfile_shortIccid_throwsBadRequest() {
    assertBadRequest(() -> resource.prepareProfile(new ProfilePrepareRequest(null, "8901")));
  }

  @Test
  void status_reportsPreparedProfiles() {
    resource.prepareProfile(new ProfilePrepareRequest(null, RspTestFixture.ICCID));

    StatusResponse status = resource.status();

    assertThat(status.getStatus()).isEqualTo(StatusResponse.ACTIVE);
    assertThat(status.getCounters()).containsEntry("profiles", 1);
  }

  private static void assertBadRequest(Runnable call) {
    assertThatThrownBy(call::run)
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
  }
}
