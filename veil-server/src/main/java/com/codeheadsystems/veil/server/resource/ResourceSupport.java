package com.codeheadsystems.veil.server.resource;

import com.codeheadsystems.veil.server.exception.NoActiveSessionException;
import com.codeheadsystems.veil.server.exception.UnknownKeyException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Translates manager exceptions into HTTP errors. Bodies never carry internal detail beyond
 * the validation message of a bad request.
 */
final class ResourceSupport {

  static final String BEARER_PREFIX = "Bearer ";

  private static final Logger log = LoggerFactory.getLogger(ResourceSupport.class);

  private ResourceSupport() {
  }

  static WebApplicationException translate(RuntimeException e) {
    if (e instanceof WebApplicationException wae) {
      return wae;
    }
    if (e instanceof IllegalArgumentException) {
      return error(Response.Status.BAD_REQUEST, e.getMessage());
    }
    if (e instanceof SecurityException) {
      log.debug("Request rejected: {}", e.getMessage());
      return error(Response.Status.UNAUTHORIZED, "Unauthorized");
    }
    if (e instanceof NoActiveSessionException || e instanceof UnknownKeyException) {
      return error(Response.Status.NOT_FOUND, e.getMessage());
    }
    if (e instanceof IllegalStateException) {
      return error(Response.Status.SERVICE_UNAVAILABLE, "Service busy, retry later");
    }
    log.error("Request failed", e);
    return error(Response.Status.INTERNAL_SERVER_ERROR, "Internal error");
  }

  static WebApplicationException error(Response.Status status, String message) {
    return new WebApplicationException(message, status);
  }

  /**
   * Extracts the token from an {@code Authorization: Bearer <token>} header.
   *
   * @param authorization header value, may be null
   * @return the token
   * @throws WebApplicationException 401 if the header is absent or not a bearer header
   */
  static String bearerToken(String authorization) {
    if (authorization == null || !authorization.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
      throw error(Response.Status.UNAUTHORIZED, "Unauthorized");
    }
    String token = authorization.substring(BEARER_PREFIX.length()).trim();
    if (token.isEmpty()) {
      throw error(Response.Status.UNAUTHORIZED, "Unauthorized");
    }
    return token;
  }

  static String iso(Instant instant) {
    return instant == null ? null : instant.toString();
  }
}
