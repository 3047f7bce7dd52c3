package com.codeheadsystems.veil.client.accessor;

import com.codeheadsystems.veil.client.exceptions.VeilAccessorException;
import com.codeheadsystems.veil.client.model.VeilConnectionInfo;
import com.codeheadsystems.veil.model.admin.CleanupStatsResponse;
import com.codeheadsystems.veil.model.auth.ChallengeRequest;
import com.codeheadsystems.veil.model.auth.ChallengeResponse;
import com.codeheadsystems.veil.model.auth.VerifyRequest;
import com.codeheadsystems.veil.model.auth.VerifyResponse;
import com.codeheadsystems.veil.model.key.KeyGenerateRequest;
import com.codeheadsystems.veil.model.key.KeyGenerateResponse;
import com.codeheadsystems.veil.model.key.KeyListResponse;
import com.codeheadsystems.veil.model.key.KeyRevokeRequest;
import com.codeheadsystems.veil.model.session.SessionEndRequest;
import com.codeheadsystems.veil.model.session.SessionEndResponse;
import com.codeheadsystems.veil.model.session.SessionInfoResponse;
import com.codeheadsystems.veil.model.session.SessionStartResponse;
import com.codeheadsystems.veil.model.session.UserLookupRequest;
import com.codeheadsystems.veil.model.session.UserLookupResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the Veil REST endpoints.
 * <p>
 * Handles request serialization, status checking and response deserialization. A 401 from any
 * endpoint surfaces as a {@link SecurityException}; other error statuses, I/O errors and
 * interruptions as a {@link VeilAccessorException}.
 */
@Singleton
public class VeilAccessor {

  static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

  private static final Logger log = LoggerFactory.getLogger(VeilAccessor.class);

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final VeilConnectionInfo connectionInfo;

  @Inject
  public VeilAccessor(final HttpClient httpClient,
                      final ObjectMapper objectMapper,
                      final VeilConnectionInfo connectionInfo) {
    log.info("VeilAccessor({})", connectionInfo.endpoint());
    this.httpClient = httpClient;
    this.objectMapper = objectMapper;
    this.connectionInfo = connectionInfo;
  }

  // ── Authentication ────────────────────────────────────────────────────────

  public ChallengeResponse challenge(final ChallengeRequest request) {
    log.debug("challenge()");
    return send(post("/auth/challenge", request), ChallengeResponse.class);
  }

  public VerifyResponse verify(final VerifyRequest request) {
    log.debug("verify()");
    return send(post("/auth/verify", request), VerifyResponse.class);
  }

  // ── Sessions ──────────────────────────────────────────────────────────────

  public SessionStartResponse startSession(final String bearerToken) {
    log.debug("startSession()");
    return send(post("/session/start", null).header("Authorization", "Bearer " + bearerToken),
        SessionStartResponse.class);
  }

  public SessionInfoResponse sessionInfo(final String bearerToken) {
    log.debug("sessionInfo()");
    return send(get("/session/info").header("Authorization", "Bearer " + bearerToken),
        SessionInfoResponse.class);
  }

  public SessionEndResponse endSession(final String bearerToken, final SessionEndRequest request) {
    log.debug("endSession()");
    return send(post("/session/end", request).header("Authorization", "Bearer " + bearerToken),
        SessionEndResponse.class);
  }

  public UserLookupResponse lookup(final String bearerToken, final UserLookupRequest request) {
    log.debug("lookup()");
    return send(post("/users/lookup", request).header("Authorization", "Bearer " + bearerToken),
        UserLookupResponse.class);
  }

  // ── Administration ────────────────────────────────────────────────────────

  public KeyGenerateResponse generateKeys(final String adminToken, final KeyGenerateRequest request) {
    log.debug("generateKeys()");
    return send(post("/keys/generate", request).header(ADMIN_TOKEN_HEADER, adminToken),
        KeyGenerateResponse.class);
  }

  public void revokeKey(final String adminToken, final KeyRevokeRequest request) {
    log.debug("revokeKey()");
    send(post("/keys/revoke", request).header(ADMIN_TOKEN_HEADER, adminToken), null);
  }

  public KeyListResponse listKeys(final String adminToken) {
    log.debug("listKeys()");
    return send(get("/keys/list").header(ADMIN_TOKEN_HEADER, adminToken), KeyListResponse.class);
  }

  public CleanupStatsResponse cleanup(final String adminToken) {
    log.debug("cleanup()");
    return send(post("/admin/cleanup", null).header(ADMIN_TOKEN_HEADER, adminToken),
        CleanupStatsResponse.class);
  }

  // ── Helpers ───────────────────────────────────────────────────────────────

  private HttpRequest.Builder get(final String path) {
    return builder(path).GET();
  }

  private HttpRequest.Builder post(final String path, final Object body) {
    try {
      String requestBody = body == null ? "{}" : objectMapper.writeValueAsString(body);
      return builder(path)
          .header("Content-Type", "application/json")
          .POST(HttpRequest.BodyPublishers.ofString(requestBody));
    } catch (IOException e) {
      throw new VeilAccessorException("Could not serialize request for " + path, e);
    }
  }

  private HttpRequest.Builder builder(final String path) {
    URI base = connectionInfo.endpoint();
    String prefix = base.getPath() == null ? "" : base.getPath().replaceAll("/+$", "");
    return HttpRequest.newBuilder()
        .uri(base.resolve(prefix + path))
        .timeout(connectionInfo.requestTimeout())
        .header("Accept", "application/json");
  }

  private <T> T send(final HttpRequest.Builder builder, final Class<T> responseType) {
    HttpRequest request = builder.build();
    try {
      HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      checkStatus(request, response.statusCode());
      if (responseType == null) {
        return null;
      }
      return objectMapper.readValue(response.body(), responseType);
    } catch (IOException e) {
      throw new VeilAccessorException("HTTP request failed: " + request.uri(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new VeilAccessorException("HTTP request interrupted: " + request.uri(), e);
    }
  }

  private void checkStatus(final HttpRequest request, final int statusCode) {
    if (statusCode == 401) {
      throw new SecurityException("Server rejected request (401): " + request.uri().getPath());
    }
    if (statusCode >= 400) {
      throw new VeilAccessorException(
          "Server returned HTTP " + statusCode + ": " + request.uri().getPath(), statusCode);
    }
  }
}
