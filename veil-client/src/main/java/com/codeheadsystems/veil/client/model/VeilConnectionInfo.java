package com.codeheadsystems.veil.client.model;

import java.net.URI;
import java.time.Duration;

/**
 * Network connection details for a Veil server.
 *
 * @param endpoint       base URL of the server, e.g. {@code http://host:8080}
 * @param requestTimeout per-request timeout
 */
public record VeilConnectionInfo(URI endpoint, Duration requestTimeout) {

  public VeilConnectionInfo {
    if (endpoint == null) {
      throw new IllegalArgumentException("endpoint is required");
    }
    if (requestTimeout == null) {
      requestTimeout = Duration.ofSeconds(10);
    }
  }

  public VeilConnectionInfo(URI endpoint) {
    this(endpoint, null);
  }
}
