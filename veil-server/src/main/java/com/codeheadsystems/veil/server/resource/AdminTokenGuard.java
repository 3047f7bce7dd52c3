package com.codeheadsystems.veil.server.resource;

import jakarta.ws.rs.core.Response;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the shared admin token sent in the {@value #HEADER} header. With no token configured
 * every admin request is refused.
 */
public class AdminTokenGuard {

  /**
   * Request header carrying the admin token.
   */
  public static final String HEADER = "X-Admin-Token";

  private static final Logger log = LoggerFactory.getLogger(AdminTokenGuard.class);

  private final byte[] expected;

  /**
   * @param adminToken the configured token; null or blank disables admin endpoints
   */
  public AdminTokenGuard(String adminToken) {
    if (adminToken == null || adminToken.isBlank()) {
      this.expected = null;
      log.warn("No admin token configured, admin endpoints are disabled");
    } else {
      this.expected = adminToken.getBytes(StandardCharsets.UTF_8);
    }
  }

  public boolean enabled() {
    return expected != null;
  }

  /**
   * @param presented the header value, may be null
   * @throws jakarta.ws.rs.WebApplicationException 403 when disabled, 401 on a missing or wrong token
   */
  public void check(String presented) {
    if (expected == null) {
      throw ResourceSupport.error(Response.Status.FORBIDDEN, "Admin endpoints are disabled");
    }
    if (presented == null
        || !MessageDigest.isEqual(expected, presented.getBytes(StandardCharsets.UTF_8))) {
      log.warn("Rejected admin request with a missing or wrong token");
      throw ResourceSupport.error(Response.Status.UNAUTHORIZED, "Unauthorized");
    }
  }
}
