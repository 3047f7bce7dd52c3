package com.codeheadsystems.veil.server.resource;

import com.codeheadsystems.veil.model.auth.ChallengeRequest;
import com.codeheadsystems.veil.model.auth.ChallengeResponse;
import com.codeheadsystems.veil.model.auth.VerifyRequest;
import com.codeheadsystems.veil.model.auth.VerifyResponse;
import com.codeheadsystems.veil.server.auth.IssuedCredential;
import com.codeheadsystems.veil.server.manager.AuthenticationManager;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * JAX-RS resource for the challenge-response login.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /auth/challenge} - issue a nonce for an authorized key</li>
 *   <li>{@code POST /auth/verify}    - check the signed nonce, return a bearer credential</li>
 * </ul>
 * Every authentication failure is a bare 401, whatever the cause.
 */
@Path("/auth")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

  private final AuthenticationManager authenticationManager;

  public AuthResource(AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
  }

  @POST
  @Path("/challenge")
  public ChallengeResponse challenge(ChallengeRequest req) {
    if (req == null) {
      throw ResourceSupport.error(Response.Status.BAD_REQUEST, "Missing request body");
    }
    try {
      return new ChallengeResponse(authenticationManager.requestChallenge(req.publicKeyBase64()));
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }

  @POST
  @Path("/verify")
  public VerifyResponse verify(VerifyRequest req) {
    if (req == null) {
      throw ResourceSupport.error(Response.Status.BAD_REQUEST, "Missing request body");
    }
    try {
      IssuedCredential credential =
          authenticationManager.verifyChallenge(req.publicKeyBase64(), req.signatureBase64());
      return new VerifyResponse(credential.token(), ResourceSupport.iso(credential.expiresAt()));
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }
}
