package com.codeheadsystems.veil.synapse;

import com.codeheadsystems.veil.crypto.RandomProvider;
import com.codeheadsystems.veil.server.exception.ProvisioningException;
import com.codeheadsystems.veil.server.provisioning.IdentityNames;
import com.codeheadsystems.veil.server.provisioning.IdentityProvisioner;
import com.codeheadsystems.veil.server.provisioning.IdentityStatus;
import com.codeheadsystems.veil.server.provisioning.ProvisionedIdentity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IdentityProvisioner} backed by the Synapse admin API and the Matrix client login API.
 * <p>
 * Endpoints used:
 * <ul>
 *   <li>{@code PUT /_synapse/admin/v2/users/{id}}  - create, or deactivate and erase</li>
 *   <li>{@code GET /_synapse/admin/v2/users/{id}}  - read status, 404 when absent</li>
 *   <li>{@code POST /_matrix/client/v3/login}      - password login for an access token</li>
 *   <li>{@code GET /_matrix/client/versions}       - reachability check</li>
 * </ul>
 * Admin calls carry the admin token as a bearer header. Every request has the configured timeout;
 * a timeout counts as a failure of the call.
 */
@Singleton
public class SynapseIdentityProvisioner implements IdentityProvisioner {

  static final String ADMIN_USERS_PATH = "/_synapse/admin/v2/users/";
  static final String LOGIN_PATH = "/_matrix/client/v3/login";
  static final String VERSIONS_PATH = "/_matrix/client/versions";

  private static final Logger log = LoggerFactory.getLogger(SynapseIdentityProvisioner.class);
  private static final int SECRET_BYTES = 32;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RandomProvider randomProvider;
  private final SynapseConfig config;

  @Inject
  public SynapseIdentityProvisioner(final HttpClient httpClient,
                                    final ObjectMapper objectMapper,
                                    final RandomProvider randomProvider,
                                    final SynapseConfig config) {
    log.info("SynapseIdentityProvisioner({})", config);
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.randomProvider = randomProvider;
    this.config = config;
    if (config.adminToken().isBlank()) {
      log.warn("No Synapse admin token configured, admin API calls will be rejected");
    }
  }

  /**
   * Builds a provisioner with its own HTTP client.
   *
   * @param config       the homeserver
   * @param objectMapper the object mapper
   * @return the provisioner
   */
  public static SynapseIdentityProvisioner create(final SynapseConfig config, final ObjectMapper objectMapper) {
    HttpClient client = HttpClient.newBuilder()
        .connectTimeout(config.requestTimeout())
        .build();
    return new SynapseIdentityProvisioner(client, objectMapper, new RandomProvider(), config);
  }

  /**
   * Creates the identity with a fresh random password. Synapse answers 201 for a new user and
   * 200 when the PUT modified an existing one; the latter is a name collision and fails.
   */
  @Override
  public ProvisionedIdentity createIdentity(final byte[] seed, final String displayName) {
    String identityId = IdentityNames.identityId(seed, config.serverName());
    String secret = randomProvider.randomUrlSafeString(SECRET_BYTES);
    ObjectNode body = objectMapper.createObjectNode()
        .put("password", secret)
        .put("displayname", displayName)
        .put("admin", false)
        .put("deactivated", false);

    HttpResponse<String> response = send(adminRequest(identityId)
        .PUT(HttpRequest.BodyPublishers.ofString(write(body)))
        .header("Content-Type", "application/json")
        .build(), "create " + identityId);
    if (response.statusCode() == 200) {
      throw new ProvisioningException("Identity already existed: " + identityId);
    }
    if (response.statusCode() != 201) {
      throw new SynapseAccessorException(
          "Synapse returned HTTP " + response.statusCode() + " creating " + identityId, response.statusCode());
    }
    log.debug("Created identity {}", identityId);
    return new ProvisionedIdentity(identityId, secret);
  }

  @Override
  public boolean deleteIdentity(final String identityId) {
    ObjectNode body = objectMapper.createObjectNode()
        .put("deactivated", true)
        .put("erase", true);
    try {
      HttpResponse<String> response = send(adminRequest(identityId)
          .PUT(HttpRequest.BodyPublishers.ofString(write(body)))
          .header("Content-Type", "application/json")
          .build(), "delete " + identityId);
      if (isSuccess(response.statusCode())) {
        log.debug("Deleted identity {}", identityId);
        return true;
      }
      log.warn("Synapse returned HTTP {} deleting {}", response.statusCode(), identityId);
      return false;
    } catch (SynapseAccessorException e) {
      log.warn("Deleting identity {} failed: {}", identityId, e.getMessage());
      return false;
    }
  }

  @Override
  public Optional<IdentityStatus> getIdentityStatus(final String identityId) {
    HttpResponse<String> response = send(adminRequest(identityId).GET().build(), "status " + identityId);
    if (response.statusCode() == 404) {
      return Optional.empty();
    }
    if (!isSuccess(response.statusCode())) {
      throw new SynapseAccessorException(
          "Synapse returned HTTP " + response.statusCode() + " reading " + identityId, response.statusCode());
    }
    JsonNode node = read(response.body(), identityId);
    return Optional.of(new IdentityStatus(identityId, node.path("deactivated").asBoolean(false)));
  }

  @Override
  public Optional<String> authenticate(final String identityId, final String secret) {
    ObjectNode body = objectMapper.createObjectNode().put("type", "m.login.password");
    body.putObject("identifier")
        .put("type", "m.id.user")
        .put("user", identityId);
    body.put("password", secret);
    try {
      HttpResponse<String> response = send(request(LOGIN_PATH)
          .POST(HttpRequest.BodyPublishers.ofString(write(body)))
          .header("Content-Type", "application/json")
          .build(), "login " + identityId);
      if (!isSuccess(response.statusCode())) {
        log.warn("Synapse returned HTTP {} logging in {}", response.statusCode(), identityId);
        return Optional.empty();
      }
      String token = read(response.body(), identityId).path("access_token").asText("");
      return token.isBlank() ? Optional.empty() : Optional.of(token);
    } catch (SynapseAccessorException e) {
      log.warn("Login of {} failed: {}", identityId, e.getMessage());
      return Optional.empty();
    }
  }

  @Override
  public String serverName() {
    return config.serverName();
  }

  @Override
  public boolean isReachable() {
    try {
      return isSuccess(send(request(VERSIONS_PATH).GET().build(), "versions").statusCode());
    } catch (SynapseAccessorException e) {
      log.debug("Synapse not reachable: {}", e.getMessage());
      return false;
    }
  }

  private HttpRequest.Builder adminRequest(final String identityId) {
    return request(ADMIN_USERS_PATH + URLEncoder.encode(identityId, StandardCharsets.UTF_8))
        .header("Authorization", "Bearer " + config.adminToken());
  }

  private HttpRequest.Builder request(final String path) {
    return HttpRequest.newBuilder()
        .uri(URI.create(config.baseUri() + path))
        .timeout(config.requestTimeout())
        .header("Accept", "application/json");
  }

  private HttpResponse<String> send(final HttpRequest request, final String operation) {
    try {
      return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new SynapseAccessorException("Synapse request failed: " + operation, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SynapseAccessorException("Synapse request interrupted: " + operation, e);
    }
  }

  private String write(final JsonNode body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (IOException e) {
      throw new SynapseAccessorException("Could not serialize Synapse request", e);
    }
  }

  private JsonNode read(final String body, final String identityId) {
    try {
      return objectMapper.readTree(body == null ? "" : body);
    } catch (IOException e) {
      throw new SynapseAccessorException("Unreadable Synapse response for " + identityId, e);
    }
  }

  private static boolean isSuccess(final int statusCode) {
    return statusCode >= 200 && statusCode < 300;
  }
}
