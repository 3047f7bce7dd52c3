package com.codeheadsystems.veil.server.resource;

import static com.codeheadsystems.veil.server.resource.JaxRsTestSupport.assertStatus;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.codeheadsystems.veil.model.session.SessionEndRequest;
import com.codeheadsystems.veil.model.session.SessionEndResponse;
import com.codeheadsystems.veil.model.session.SessionInfoResponse;
import com.codeheadsystems.veil.model.session.SessionStartResponse;
import com.codeheadsystems.veil.server.exception.AuthenticationException;
import com.codeheadsystems.veil.server.exception.NoActiveSessionException;
import com.codeheadsystems.veil.server.exception.ProvisioningException;
import com.codeheadsystems.veil.server.manager.AuthenticationManager;
import com.codeheadsystems.veil.server.manager.SessionManager;
import com.codeheadsystems.veil.server.model.ChatSession;
import com.codeheadsystems.veil.server.model.SessionDescriptor;
import com.codeheadsystems.veil.server.model.SessionState;
import jakarta.ws.rs.core.Response;
import java.time.Instant;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionResourceTest {

  private static final String PUBLIC_KEY = "cHVibGljLWtleQ==";
  private static final String BEARER = "Bearer jwt";
  private static final Instant CREATED = Instant.parse("2026-03-01T12:00:00Z");

  @Mock private AuthenticationManager authenticationManager;
  @Mock private SessionManager sessionManager;

  private SessionResource resource;

  @BeforeAll
  static void installRuntimeDelegate() {
    JaxRsTestSupport.installRuntimeDelegate();
  }

  @AfterAll
  static void removeRuntimeDelegate() {
    JaxRsTestSupport.removeRuntimeDelegate();
  }

  @BeforeEach
  void setUp() {
    resource = new SessionResource(authenticationManager, sessionManager);
  }

  private static ChatSession session(String credential) {
    return new ChatSession("sid", PUBLIC_KEY, "@temp_0011223344556677:veil.local", "SilentFox0042",
        credential, CREATED, CREATED.plusSeconds(60), SessionState.ACTIVE);
  }

  @Test
  void start_newSession_returnsSecretOnce() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);
    when(sessionManager.startSession(PUBLIC_KEY))
        .thenReturn(new SessionDescriptor(session("syt_token"), "secret", false));
    when(sessionManager.serverName()).thenReturn("veil.local");

    SessionStartResponse response = resource.start(BEARER);

    assertThat(response.sessionId()).isEqualTo("sid");
    assertThat(response.serverName()).isEqualTo("veil.local");
    assertThat(response.credential()).isEqualTo("syt_token");
    assertThat(response.identitySecret()).isEqualTo("secret");
    assertThat(response.degraded()).isFalse();
    assertThat(response.reused()).isFalse();
  }

  @Test
  void start_degradedSession_reportsDegraded() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);
    when(sessionManager.startSession(PUBLIC_KEY))
        .thenReturn(new SessionDescriptor(session(null), "secret", false));
    when(sessionManager.serverName()).thenReturn("veil.local");

    SessionStartResponse response = resource.start(BEARER);

    assertThat(response.degraded()).isTrue();
    assertThat(response.credential()).isNull();
  }

  @Test
  void start_missingBearer_is401() {
    assertStatus(() -> resource.start(null), Response.Status.UNAUTHORIZED);
    assertStatus(() -> resource.start("Basic abc"), Response.Status.UNAUTHORIZED);
    assertStatus(() -> resource.start("Bearer   "), Response.Status.UNAUTHORIZED);
    verifyNoInteractions(authenticationManager, sessionManager);
  }

  @Test
  void start_invalidCredential_is401() {
    when(authenticationManager.validateCredential("jwt"))
        .thenThrow(new AuthenticationException(AuthenticationException.Reason.INVALID_CREDENTIAL));

    assertStatus(() -> resource.start(BEARER), Response.Status.UNAUTHORIZED);
    verifyNoInteractions(sessionManager);
  }

  @Test
  void start_provisioningFailure_is500() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);
    when(sessionManager.startSession(PUBLIC_KEY)).thenThrow(new ProvisioningException("homeserver down"));

    assertStatus(() -> resource.start(BEARER), Response.Status.INTERNAL_SERVER_ERROR);
  }

  @Test
  void info_returnsSession() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);
    when(sessionManager.getSessionInfo(PUBLIC_KEY)).thenReturn(session("syt_token"));

    SessionInfoResponse response = resource.info("bearer jwt");

    assertThat(response.sessionId()).isEqualTo("sid");
    assertThat(response.alias()).isEqualTo("SilentFox0042");
    assertThat(response.createdAt()).isEqualTo("2026-03-01T12:00:00Z");
    assertThat(response.lastActivityAt()).isEqualTo("2026-03-01T12:01:00Z");
    assertThat(response.active()).isTrue();
  }

  @Test
  void info_noActiveSession_is404() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);
    when(sessionManager.getSessionInfo(PUBLIC_KEY)).thenThrow(new NoActiveSessionException("No active session"));

    assertStatus(() -> resource.info(BEARER), Response.Status.NOT_FOUND);
  }

  @Test
  void end_reportsIdentityDeletion() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);
    when(sessionManager.endSession("sid", PUBLIC_KEY)).thenReturn(false);

    SessionEndResponse response = resource.end(BEARER, new SessionEndRequest("sid"));

    assertThat(response.sessionId()).isEqualTo("sid");
    assertThat(response.identityDeleted()).isFalse();
  }

  @Test
  void end_missingBody_is400() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);

    assertStatus(() -> resource.end(BEARER, null), Response.Status.BAD_REQUEST);
    verifyNoInteractions(sessionManager);
  }

  @Test
  void end_foreignSession_is404() {
    when(authenticationManager.validateCredential("jwt")).thenReturn(PUBLIC_KEY);
    when(sessionManager.endSession("other", PUBLIC_KEY))
        .thenThrow(new NoActiveSessionException("Session not found or already ended"));

    assertStatus(() -> resource.end(BEARER, new SessionEndRequest("other")), Response.Status.NOT_FOUND);
  }
}
