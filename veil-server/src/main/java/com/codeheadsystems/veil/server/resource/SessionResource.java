package com.codeheadsystems.veil.server.resource;

import com.codeheadsystems.veil.model.session.SessionEndRequest;
import com.codeheadsystems.veil.model.session.SessionEndResponse;
import com.codeheadsystems.veil.model.session.SessionInfoResponse;
import com.codeheadsystems.veil.model.session.SessionStartResponse;
import com.codeheadsystems.veil.server.manager.AuthenticationManager;
import com.codeheadsystems.veil.server.manager.SessionManager;
import com.codeheadsystems.veil.server.model.ChatSession;
import com.codeheadsystems.veil.server.model.SessionDescriptor;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * JAX-RS resource for the chat session lifecycle. Every call needs a bearer credential.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /session/start} - reuse or create the caller's session</li>
 *   <li>{@code GET /session/info}   - read the caller's active session</li>
 *   <li>{@code POST /session/end}   - end one of the caller's sessions</li>
 * </ul>
 */
@Path("/session")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class SessionResource {

  private final AuthenticationManager authenticationManager;
  private final SessionManager sessionManager;

  public SessionResource(AuthenticationManager authenticationManager, SessionManager sessionManager) {
    this.authenticationManager = authenticationManager;
    this.sessionManager = sessionManager;
  }

  @POST
  @Path("/start")
  public SessionStartResponse start(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    try {
      String publicKey = authenticationManager.validateCredential(ResourceSupport.bearerToken(authorization));
      SessionDescriptor descriptor = sessionManager.startSession(publicKey);
      ChatSession session = descriptor.session();
      return new SessionStartResponse(
          session.sessionId(),
          session.externalIdentityId(),
          session.alias(),
          sessionManager.serverName(),
          session.credential(),
          descriptor.identitySecret(),
          descriptor.degraded(),
          descriptor.reused());
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }

  @GET
  @Path("/info")
  public SessionInfoResponse info(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization) {
    try {
      String publicKey = authenticationManager.validateCredential(ResourceSupport.bearerToken(authorization));
      ChatSession session = sessionManager.getSessionInfo(publicKey);
      return new SessionInfoResponse(
          session.sessionId(),
          session.alias(),
          session.externalIdentityId(),
          ResourceSupport.iso(session.createdAt()),
          ResourceSupport.iso(session.lastActivityAt()),
          session.isActive());
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }

  @POST
  @Path("/end")
  public SessionEndResponse end(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                SessionEndRequest req) {
    try {
      String publicKey = authenticationManager.validateCredential(ResourceSupport.bearerToken(authorization));
      if (req == null) {
        throw ResourceSupport.error(Response.Status.BAD_REQUEST, "Missing request body");
      }
      boolean deleted = sessionManager.endSession(req.sessionId(), publicKey);
      return new SessionEndResponse(req.sessionId(), deleted);
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }
}
