package com.codeheadsystems.veil.server.resource;

import com.codeheadsystems.veil.model.admin.CleanupStatsResponse;
import com.codeheadsystems.veil.server.manager.CleanupManager;
import com.codeheadsystems.veil.server.model.CleanupStats;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

/**
 * {@code POST /admin/cleanup}: runs the full cleanup now and reports what it removed.
 * Guarded by the admin token.
 */
@Path("/admin")
@Produces(MediaType.APPLICATION_JSON)
public class AdminResource {

  private final CleanupManager cleanupManager;
  private final AdminTokenGuard guard;

  public AdminResource(CleanupManager cleanupManager, AdminTokenGuard guard) {
    this.cleanupManager = cleanupManager;
    this.guard = guard;
  }

  @POST
  @Path("/cleanup")
  public CleanupStatsResponse cleanup(@HeaderParam(AdminTokenGuard.HEADER) String adminToken) {
    guard.check(adminToken);
    CleanupStats stats = cleanupManager.runFullCleanup();
    return new CleanupStatsResponse(
        ResourceSupport.iso(stats.timestamp()),
        stats.expiredKeysRemoved(),
        stats.inactiveSessionsDeactivated(),
        stats.orphanedIdentitiesRemoved(),
        stats.total());
  }
}
