package com.codeheadsystems.veil.server.resource;

import com.codeheadsystems.veil.model.session.UserLookupRequest;
import com.codeheadsystems.veil.model.session.UserLookupResponse;
import com.codeheadsystems.veil.server.manager.AuthenticationManager;
import com.codeheadsystems.veil.server.manager.SessionManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * {@code POST /users/lookup}: finds an online user by alias, public key or identity id so a
 * caller can open a chat with them. Requires a bearer credential.
 */
@Path("/users")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class UserResource {

  private final AuthenticationManager authenticationManager;
  private final SessionManager sessionManager;

  public UserResource(AuthenticationManager authenticationManager, SessionManager sessionManager) {
    this.authenticationManager = authenticationManager;
    this.sessionManager = sessionManager;
  }

  @POST
  @Path("/lookup")
  public UserLookupResponse lookup(@HeaderParam(HttpHeaders.AUTHORIZATION) String authorization,
                                   UserLookupRequest req) {
    try {
      authenticationManager.validateCredential(ResourceSupport.bearerToken(authorization));
      if (req == null) {
        throw ResourceSupport.error(Response.Status.BAD_REQUEST, "Missing request body");
      }
      return sessionManager.lookup(req.query())
          .map(s -> new UserLookupResponse(true, s.externalIdentityId(), s.alias(), s.publicKeyBase64()))
          .orElseGet(UserLookupResponse::notFound);
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }
}
