package org.m2mrsp.server.resource;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.m2mrsp.model.IsdpCreateRequest;
import org.m2mrsp.model.IsdpCreateResponse;
import org.m2mrsp.model.ProfileInstallResponse;
import org.m2mrsp.model.StatusResponse;
import org.m2mrsp.server.entity.EuiccDirectory;
import org.m2mrsp.server.entity.SmSr;
import org.m2mrsp.server.orchestrator.ProvisioningOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SM-SR endpoints.
 * <ul>
 *   <li>{@code POST /smsr/isdp/create}: allocate an ISD-P and create it on the card over ES8</li>
 *   <li>{@code GET /smsr/isdp/{isdpAid}/profile}: PSK-protected segments held for delivery</li>
 *   <li>{@code GET /smsr/status}</li>
 * </ul>
 */
@Singleton
@Path("/smsr")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SmSrResource {

  private static final Logger log = LoggerFactory.getLogger(SmSrResource.class);

  private final SmSr smSr;
  private final EuiccDirectory euiccs;
  private final ProvisioningOrchestrator orchestrator;

  @Inject
  public SmSrResource(final SmSr smSr,
                      final EuiccDirectory euiccs,
                      final ProvisioningOrchestrator orchestrator) {
    this.smSr = smSr;
    this.euiccs = euiccs;
    this.orchestrator = orchestrator;
    log.info("SmSrResource({})", smSr);
  }

  @POST
  @Path("/isdp/create")
  public IsdpCreateResponse createIsdp(final IsdpCreateRequest request) {
    log.trace("createIsdp({})", request);
    Requests.requireField(request.euiccId(), "euiccId");
    Requests.requirePositive(request.memoryRequired(), "memoryRequired");
    final String isdpAid = orchestrator.createIsdp(euiccs.require(request.euiccId()),
        request.memoryRequired());
    return new IsdpCreateResponse(isdpAid, request.euiccId());
  }

  @GET
  @Path("/isdp/{isdpAid}/profile")
  public List<ProfileInstallResponse> profileSegments(@PathParam("isdpAid") final String isdpAid) {
    log.trace("profileSegments({})", isdpAid);
    return smSr.deliverProfile(isdpAid).stream()
        .map(ProfileInstallResponse::new)
        .toList();
  }

  @GET
  @Path("/status")
  public StatusResponse status() {
    return new StatusResponse(smSr.status());
  }
}
