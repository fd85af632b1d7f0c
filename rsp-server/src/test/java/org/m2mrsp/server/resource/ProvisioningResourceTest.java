package org.m2mrsp.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.RuntimeDelegate;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.m2mrsp.model.ProvisioningRequest;
import org.m2mrsp.model.ProvisioningResponse;
import org.m2mrsp.protocol.model.ProfileStatus;
import org.m2mrsp.server.RspTestFixture;
import org.m2mrsp.server.entity.Euicc;
import org.m2mrsp.server.entity.EuiccDirectory;
import org.m2mrsp.server.entity.SmDp;
import org.m2mrsp.server.orchestrator.ProtocolPhase;
import org.m2mrsp.server.orchestrator.ProvisioningOrchestrator;
import org.m2mrsp.server.orchestrator.ProvisioningResult;
import org.mockito.Mock;
import org.mockito.Mockito;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProvisioningResourceTest {

  @Mock private ProvisioningOrchestrator orchestrator;
  @Mock private Euicc euicc;
  private ProvisioningResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
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
    when(euicc.getEuiccId()).thenReturn(RspTestFixture.EUICC_ID);
    EuiccDirectory directory = new EuiccDirectory();
    directory.add(euicc);
    resource = new ProvisioningResource(orchestrator, directory);
  }

  @Test
  void run_reportsResultAndPhaseTimings() {
    ProvisioningResult result = new ProvisioningResult(RspTestFixture.EUICC_ID,
        "A000000559101000000001", "session-1", RspTestFixture.ICCID, "ab12", null,
        ProfileStatus.ENABLED, Map.of(ProtocolPhase.ISDP_CREATION, Duration.ofMillis(7)));
    when(orchestrator.provision(euicc, RspTestFixture.MEMORY, SmDp.DEFAULT_PROFILE_TYPE,
        RspTestFixture.ICCID)).thenReturn(result);

    ProvisioningResponse response = resource.run(new ProvisioningRequest(RspTestFixture.EUICC_ID,
        RspTestFixture.MEMORY, null, RspTestFixture.ICCID));

    assertThat(response.status()).isEqualTo("success");
    assertThat(response.isdpAid()).isEqualTo("A000000559101000000001");
    assertThat(response.profileStatus()).isEqualTo("enabled");
    assertThat(response.phaseMillis()).containsEntry("isdp_creation", 7L);
  }

  @Test
  void run_explicitProfileType_isPassedThrough() {
    when(orchestrator.provision(eq(euicc), anyInt(), anyString(), anyString()))
        .thenReturn(new ProvisioningResult(RspTestFixture.EUICC_ID, "aid", "s",
            RspTestFixture.ICCID, "h", null, ProfileStatus.ENABLED, Map.of()));

    resource.run(new ProvisioningRequest(RspTestFixture.EUICC_ID, RspTestFixture.MEMORY,
        "m2m", RspTestFixture.ICCID));

    verify(orchestrator).provision(euicc, RspTestFixture.MEMORY, "m2m", RspTestFixture.ICCID);
  }

  @Test
  void run_missingIccid_throwsBadRequest() {
    assertThatThrownBy(() -> resource.run(new ProvisioningRequest(RspTestFixture.EUICC_ID,
        RspTestFixture.MEMORY, null, null)))
        .isInstanceOf(WebApplicationException.class)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
    verifyNoInteractions(orchestrator);
  }

  @Test
  void run_nonNumericIccid_throwsBadRequestBeforeProvisioning() {
    assertThatThrownBy(() -> resource.run(new ProvisioningRequest(RspTestFixture.EUICC_ID,
        RspTestFixture.MEMORY, null, "abc")))
        .isInstanceOf(WebApplicationException.class)
        .hasMessage(SmDp.INVALID_ICCID)
        .satisfies(e -> assertThat(((WebApplicationException) e).getResponse().getStatus())
            .isEqualTo(Response.Status.BAD_REQUEST.getStatusCode()));
    verifyNoInteractions(orchestrator);
  }
}
