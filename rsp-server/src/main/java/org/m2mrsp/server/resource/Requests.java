package org.m2mrsp.server.resource;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import org.m2mrsp.server.entity.SmDp;

/**
 * Input checks shared by the resources. Malformed requests become 400 before they reach an
 * entity.
 */
final class Requests {

  private Requests() {
  }

  static void requireField(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new WebApplicationException("Missing required field: " + field,
          Response.Status.BAD_REQUEST);
    }
  }

  static void requireIccid(String iccid) {
    requireField(iccid, "iccid");
    if (!SmDp.isValidIccid(iccid)) {
      throw new WebApplicationException(SmDp.INVALID_ICCID, Response.Status.BAD_REQUEST);
    }
  }

  static void requirePositive(int value, String field) {
    if (value <= 0) {
      throw new WebApplicationException("Field must be positive: " + field,
          Response.Status.BAD_REQUEST);
    }
  }
}
