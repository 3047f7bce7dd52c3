package com.codeheadsystems.veil.server.resource;

import com.codeheadsystems.veil.model.key.GeneratedKey;
import com.codeheadsystems.veil.model.key.KeyGenerateRequest;
import com.codeheadsystems.veil.model.key.KeyGenerateResponse;
import com.codeheadsystems.veil.model.key.KeyListResponse;
import com.codeheadsystems.veil.model.key.KeyRevokeRequest;
import com.codeheadsystems.veil.model.key.KeySummary;
import com.codeheadsystems.veil.server.manager.KeyManager;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.stream.Collectors;

/**
 * JAX-RS resource for key administration, guarded by the admin token.
 * <p>
 * Endpoints:
 * <ul>
 *   <li>{@code POST /keys/generate} - authorize new key pairs, private halves returned once</li>
 *   <li>{@code POST /keys/revoke}   - deactivate a key</li>
 *   <li>{@code GET /keys/list}      - list stored keys</li>
 * </ul>
 */
@Path("/keys")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class KeyResource {

  private final KeyManager keyManager;
  private final AdminTokenGuard guard;

  public KeyResource(KeyManager keyManager, AdminTokenGuard guard) {
    this.keyManager = keyManager;
    this.guard = guard;
  }

  @POST
  @Path("/generate")
  public KeyGenerateResponse generate(@HeaderParam(AdminTokenGuard.HEADER) String adminToken,
                                      KeyGenerateRequest req) {
    guard.check(adminToken);
    int count = req == null ? 1 : req.count();
    try {
      List<GeneratedKey> keys = keyManager.generateKeys(count).stream()
          .map(k -> new GeneratedKey(k.key().publicKeyBase64(), k.privateKeyBase64(),
              ResourceSupport.iso(k.key().expiresAt())))
          .collect(Collectors.toList());
      return new KeyGenerateResponse(keys.size(), keys);
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }

  @POST
  @Path("/revoke")
  public Response revoke(@HeaderParam(AdminTokenGuard.HEADER) String adminToken, KeyRevokeRequest req) {
    guard.check(adminToken);
    if (req == null) {
      throw ResourceSupport.error(Response.Status.BAD_REQUEST, "Missing request body");
    }
    try {
      keyManager.revokeKey(req.publicKeyBase64());
      return Response.noContent().build();
    } catch (RuntimeException e) {
      throw ResourceSupport.translate(e);
    }
  }

  @GET
  @Path("/list")
  public KeyListResponse list(@HeaderParam(AdminTokenGuard.HEADER) String adminToken) {
    guard.check(adminToken);
    List<KeySummary> keys = keyManager.listKeys().stream()
        .map(KeyResource::summary)
        .collect(Collectors.toList());
    return new KeyListResponse(keys.size(), keys);
  }

  private static KeySummary summary(AuthorizedKey key) {
    return new KeySummary(
        key.publicKeyBase64(),
        key.active(),
        ResourceSupport.iso(key.createdAt()),
        ResourceSupport.iso(key.expiresAt()),
        ResourceSupport.iso(key.lastUsedAt()));
  }
}
