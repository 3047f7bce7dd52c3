package com.codeheadsystems.veil.synapse;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;

/**
 * Connection details for a Synapse homeserver.
 *
 * @param baseUri        base URL of the homeserver, e.g. {@code http://synapse:8008}
 * @param serverName     Matrix server name used in identity ids
 * @param adminToken     access token of a server admin, sent on every admin API call
 * @param requestTimeout per-request timeout
 */
public record SynapseConfig(URI baseUri, String serverName, String adminToken, Duration requestTimeout) {

  /**
   * Timeout used when none is configured.
   */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

  public SynapseConfig {
    Objects.requireNonNull(baseUri, "baseUri");
    if (serverName == null || serverName.isBlank()) {
      throw new IllegalArgumentException("serverName must not be blank");
    }
    if (adminToken == null) {
      adminToken = "";
    }
    if (requestTimeout == null) {
      requestTimeout = DEFAULT_TIMEOUT;
    }
    if (requestTimeout.isNegative() || requestTimeout.isZero()) {
      throw new IllegalArgumentException("requestTimeout must be positive");
    }
    String path = baseUri.toString();
    if (path.endsWith("/")) {
      baseUri = URI.create(path.substring(0, path.length() - 1));
    }
  }

  @Override
  public String toString() {
    return "SynapseConfig[baseUri=" + baseUri + ", serverName=" + serverName
        + ", requestTimeout=" + requestTimeout + "]";
  }
}
