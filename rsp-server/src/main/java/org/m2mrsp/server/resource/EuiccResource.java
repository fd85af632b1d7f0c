package org.m2mrsp.server.resource;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.m2mrsp.model.KeyEstablishmentCompleteRequest;
import org.m2mrsp.model.KeyEstablishmentInitResponse;
import org.m2mrsp.model.StatusResponse;
import org.m2mrsp.protocol.model.KeyEstablishmentOffer;
import org.m2mrsp.server.entity.EuiccDirectory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulated card endpoints. {@code POST /euicc/{euiccId}/key-establishment} takes the SM-DP
 * offer exactly as {@code /smdp/key-establishment/init} returned it and answers with the body
 * for {@code /smdp/key-establishment/complete}.
 */
@Singleton
@Path("/euicc/{euiccId}")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class EuiccResource {

  private static final Logger log = LoggerFactory.getLogger(EuiccResource.class);

  private final EuiccDirectory euiccs;

  @Inject
  public EuiccResource(final EuiccDirectory euiccs) {
    this.euiccs = euiccs;
    log.info("EuiccResource({} card(s))", euiccs.all().size());
  }

  @GET
  @Path("/status")
  public StatusResponse status(@PathParam("euiccId") final String euiccId) {
    return new StatusResponse(euiccs.require(euiccId).status());
  }

  @POST
  @Path("/key-establishment")
  public KeyEstablishmentCompleteRequest respondToKeyEstablishment(
      @PathParam("euiccId") final String euiccId,
      final KeyEstablishmentInitResponse request) {
    Requests.requireField(request.sessionId(), "session_id");
    log.trace("respondToKeyEstablishment({}, sessionId={})", euiccId, request.sessionId());
    final KeyEstablishmentOffer offer;
    try {
      offer = request.offer();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
    return new KeyEstablishmentCompleteRequest(
        euiccs.require(euiccId).respondToKeyEstablishment(offer));
  }
}
