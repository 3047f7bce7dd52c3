package com.codeheadsystems.veil.dropwizard;

import com.codeheadsystems.veil.synapse.SynapseConfig;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import java.net.URI;
import java.time.Duration;

/**
 * The {@code synapse} block of {@link VeilConfiguration}. With no {@code baseUrl} the bundle
 * falls back to an in-memory provisioner.
 */
public class SynapseConfiguration {

  private String baseUrl = "";

  @NotEmpty
  private String serverName = "veil.local";

  private String adminToken = "";

  @Min(1)
  private long requestTimeoutSeconds = 10;

  /**
   * @return true if a homeserver URL is configured
   */
  @JsonIgnore
  public boolean isEnabled() {
    return baseUrl != null && !baseUrl.isBlank();
  }

  /**
   * Builds the provisioner settings.
   *
   * @return the settings
   * @throws IllegalStateException if no base URL is configured
   */
  public SynapseConfig toSynapseConfig() {
    if (!isEnabled()) {
      throw new IllegalStateException("synapse.baseUrl is not configured");
    }
    return new SynapseConfig(URI.create(baseUrl.trim()), serverName, adminToken,
        Duration.ofSeconds(requestTimeoutSeconds));
  }

  /**
   * Gets base url.
   *
   * @return the base url
   */
  @JsonProperty
  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Sets base url.
   *
   * @param baseUrl the base url
   */
  @JsonProperty
  public void setBaseUrl(String baseUrl) {
    this.baseUrl = baseUrl;
  }

  /**
   * Gets server name.
   *
   * @return the server name
   */
  @JsonProperty
  public String getServerName() {
    return serverName;
  }

  /**
   * Sets server name.
   *
   * @param serverName the server name
   */
  @JsonProperty
  public void setServerName(String serverName) {
    this.serverName = serverName;
  }

  /**
   * Gets admin token.
   *
   * @return the admin token
   */
  @JsonProperty
  public String getAdminToken() {
    return adminToken;
  }

  /**
   * Sets admin token.
   *
   * @param adminToken the admin token
   */
  @JsonProperty
  public void setAdminToken(String adminToken) {
    this.adminToken = adminToken;
  }

  /**
   * Gets request timeout seconds.
   *
   * @return the request timeout seconds
   */
  @JsonProperty
  public long getRequestTimeoutSeconds() {
    return requestTimeoutSeconds;
  }

  /**
   * Sets request timeout seconds.
   *
   * @param requestTimeoutSeconds the request timeout seconds
   */
  @JsonProperty
  public void setRequestTimeoutSeconds(long requestTimeoutSeconds) {
    this.requestTimeoutSeconds = requestTimeoutSeconds;
  }
}
