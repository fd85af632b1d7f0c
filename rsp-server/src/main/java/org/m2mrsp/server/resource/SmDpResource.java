package org.m2mrsp.server.resource;

import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.m2mrsp.model.KeyEstablishmentCompleteRequest;
import org.m2mrsp.model.KeyEstablishmentCompleteResponse;
import org.m2mrsp.model.KeyEstablishmentInitRequest;
import org.m2mrsp.model.KeyEstablishmentInitResponse;
import org.m2mrsp.model.ProfilePrepareRequest;
import org.m2mrsp.model.ProfilePrepareResponse;
import org.m2mrsp.model.StatusResponse;
import org.m2mrsp.protocol.model.KeyEstablishmentResponse;
import org.m2mrsp.server.entity.SmDp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * SM-DP endpoints.
 * <ul>
 *   <li>{@code POST /smdp/key-establishment/init}: signed ephemeral offer for an ISD-P</li>
 *   <li>{@code POST /smdp/key-establishment/complete}: verify the card receipt, derive keys</li>
 *   <li>{@code POST /smdp/profile/prepare}: build a profile and its integrity hash</li>
 *   <li>{@code GET /smdp/status}</li>
 * </ul>
 * Protocol failures surface as {@link org.m2mrsp.protocol.exception.RspException} and are
 * rendered by {@link RspExceptionMapper}.
 */
@Singleton
@Path("/smdp")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SmDpResource {

  private static final Logger log = LoggerFactory.getLogger(SmDpResource.class);

  private final SmDp smDp;

  @Inject
  public SmDpResource(final SmDp smDp) {
    this.smDp = smDp;
    log.info("SmDpResource({})", smDp);
  }

  // ── Key establishment ─────────────────────────────────────────────────────

  @POST
  @Path("/key-establishment/init")
  public KeyEstablishmentInitResponse initKeyEstablishment(final KeyEstablishmentInitRequest request) {
    log.trace("initKeyEstablishment({})", request);
    Requests.requireField(request.euiccId(), "euiccId");
    Requests.requireField(request.isdpAid(), "isdpAid");
    return new KeyEstablishmentInitResponse(
        smDp.initKeyEstablishment(request.euiccId(), request.isdpAid()));
  }

  @POST
  @Path("/key-establishment/complete")
  public KeyEstablishmentCompleteResponse completeKeyEstablishment(
      final KeyEstablishmentCompleteRequest request) {
    Requests.requireField(request.sessionId(), "session_id");
    log.trace("completeKeyEstablishment(sessionId={})", request.sessionId());
    final KeyEstablishmentResponse response;
    try {
      response = request.response();
    } catch (IllegalArgumentException e) {
      throw new WebApplicationException(e.getMessage(), Response.Status.BAD_REQUEST);
    }
    smDp.completeKeyEstablishment(response);
    return new KeyEstablishmentCompleteResponse(request.sessionId());
  }

  // ── Profiles ──────────────────────────────────────────────────────────────

  @POST
  @Path("/profile/prepare")
  public ProfilePrepareResponse prepareProfile(final ProfilePrepareRequest request) {
    log.trace("prepareProfile({})", request);
    Requests.requireIccid(request.iccid());
    final String profileType = request.profileType() == null || request.profileType().isBlank()
        ? SmDp.DEFAULT_PROFILE_TYPE
        : request.profileType();
    return new ProfilePrepareResponse(smDp.prepareProfile(profileType, request.iccid()));
  }

  @GET
  @Path("/status")
  public StatusResponse status() {
    return new StatusResponse(smDp.status());
  }
}
