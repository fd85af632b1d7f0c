package org.m2mrsp.server.resource;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import javax.inject.Singleton;
import org.m2mrsp.model.ErrorResponse;
import org.m2mrsp.protocol.exception.ErrorKind;
import org.m2mrsp.protocol.exception.RspException;
import org.m2mrsp.server.orchestrator.ProtocolAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders protocol failures as {@link ErrorResponse} bodies. The status code follows the
 * {@link ErrorKind}; an aborted orchestration reports the message of the phase failure.
 */
@Singleton
public class RspExceptionMapper implements ExceptionMapper<RspException> {

  private static final Logger log = LoggerFactory.getLogger(RspExceptionMapper.class);

  /**
   * Not in {@link Response.Status}.
   */
  public static final int INSUFFICIENT_STORAGE = 507;

  @Override
  public Response toResponse(final RspException exception) {
    final int status = statusFor(exception.getErrorKind());
    final String message = exception instanceof ProtocolAbortedException aborted
        ? aborted.getCause().getMessage()
        : exception.getMessage();
    log.warn("{} -> {}: {}", exception.getErrorKind(), status, exception.getMessage());
    return Response.status(status)
        .type(MediaType.APPLICATION_JSON_TYPE)
        .entity(new ErrorResponse(message))
        .build();
  }

  /**
   * HTTP status for an error kind.
   *
   * @param kind the failure category
   * @return the status code
   */
  public static int statusFor(final ErrorKind kind) {
    return switch (kind) {
      case INVALID_PUBLIC_KEY, INVALID_KEY_LENGTH, DECRYPTION_FAILED, INVALID_SESSION -> 400;
      case SIGNATURE_VERIFICATION_FAILED, CERTIFICATE_VERIFICATION_FAILED,
          MAC_VERIFICATION_FAILED, PROFILE_INTEGRITY_FAILED -> 401;
      case PROFILE_NOT_FOUND, EUICC_NOT_REGISTERED -> 404;
      case INVALID_ISDP_STATE, PSK_NOT_ESTABLISHED -> 409;
      case SESSION_EXPIRED -> 410;
      case INSUFFICIENT_MEMORY -> INSUFFICIENT_STORAGE;
    };
  }
}
