package org.m2mrsp.server.resource;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import javax.inject.Singleton;
import org.m2mrsp.model.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gives request rejections (missing fields, undecodable values, unknown paths) the same
 * {@link ErrorResponse} body as protocol failures. Responses below 400 pass through untouched.
 */
@Singleton
public class WebApplicationExceptionMapper implements ExceptionMapper<WebApplicationException> {

  private static final Logger log = LoggerFactory.getLogger(WebApplicationExceptionMapper.class);

  @Override
  public Response toResponse(final WebApplicationException exception) {
    final Response original = exception.getResponse();
    final int status = original.getStatus();
    if (status < 400) {
      return original;
    }
    log.debug("Request rejected with {}: {}", status, exception.getMessage());
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(exception.getMessage()))
        .build();
  }
}
