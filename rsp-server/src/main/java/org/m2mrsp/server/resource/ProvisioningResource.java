package org.m2mrsp.server.resource;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.m2mrsp.model.ProvisioningRequest;
import org.m2mrsp.model.ProvisioningResponse;
import org.m2mrsp.server.entity.EuiccDirectory;
import org.m2mrsp.server.entity.SmDp;
import org.m2mrsp.server.orchestrator.ProvisioningOrchestrator;
import org.m2mrsp.server.orchestrator.ProvisioningResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code POST /provisioning/run}: drives a full provisioning run for one attached eUICC.
 */
@Singleton
@Path("/provisioning")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ProvisioningResource {

  private static final Logger log = LoggerFactory.getLogger(ProvisioningResource.class);

  private final ProvisioningOrchestrator orchestrator;
  private final EuiccDirectory euiccs;

  @Inject
  public ProvisioningResource(final ProvisioningOrchestrator orchestrator,
                              final EuiccDirectory euiccs) {
    this.orchestrator = orchestrator;
    this.euiccs = euiccs;
    log.info("ProvisioningResource({})", orchestrator);
  }

  @POST
  @Path("/run")
  public ProvisioningResponse run(final ProvisioningRequest request) {
    log.trace("run({})", request);
    Requests.requireField(request.euiccId(), "euiccId");
    Requests.requireIccid(request.iccid());
    Requests.requirePositive(request.memoryRequired(), "memoryRequired");
    final String profileType = request.profileType() == null || request.profileType().isBlank()
        ? SmDp.DEFAULT_PROFILE_TYPE
        : request.profileType();
    final ProvisioningResult result = orchestrator.provision(euiccs.require(request.euiccId()),
        request.memoryRequired(), profileType, request.iccid());
    final Map<String, Long> phaseMillis = new LinkedHashMap<>();
    result.timings().forEach((phase, duration) -> phaseMillis.put(phase.metricName(),
        duration.toMillis()));
    return new ProvisioningResponse("success", result.euiccId(), result.isdpAid(),
        result.sessionId(), result.iccid(), result.integrityHash(),
        result.profileStatus().value(), phaseMillis);
  }
}
