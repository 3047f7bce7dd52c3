package com.codeheadsystems.veil.server.manager;

import com.codeheadsystems.veil.server.cache.ChallengeCache;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import com.codeheadsystems.veil.server.model.ChatSession;
import com.codeheadsystems.veil.server.model.CleanupStats;
import com.codeheadsystems.veil.server.provisioning.IdentityProvisioner;
import com.codeheadsystems.veil.server.provisioning.IdentityStatus;
import com.codeheadsystems.veil.server.store.RecordStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Idempotent sweeps that reclaim expired keys, idle sessions and orphaned identities.
 * <p>
 * Each sweep first makes its remote calls with no transaction open, then applies the local
 * changes for the whole batch in one transaction. Local changes re-read each record so a
 * concurrent request that already changed it wins. A remote failure for one candidate is logged
 * and the sweep moves on to the next.
 */
public class CleanupManager {

  private static final Logger log = LoggerFactory.getLogger(CleanupManager.class);

  private final RecordStore store;
  private final IdentityProvisioner provisioner;
  private final ChallengeCache challengeCache;
  private final Duration sessionTimeout;
  private final Clock clock;

  public CleanupManager(RecordStore store,
                        IdentityProvisioner provisioner,
                        ChallengeCache challengeCache,
                        Duration sessionTimeout,
                        Clock clock) {
    this.store = store;
    this.provisioner = provisioner;
    this.challengeCache = challengeCache;
    this.sessionTimeout = sessionTimeout;
    this.clock = clock;
  }

  /**
   * Hard-deletes every key that expired before now, together with its sessions. The cascade
   * leaves no local row behind, so each session's identity is handled remotely first, best
   * effort: active ones are deleted and inactive ones are reconciled like orphans.
   *
   * @return number of keys deleted
   */
  public int cleanupExpiredKeys() {
    Instant now = clock.instant();
    List<AuthorizedKey> expired = store.findExpiredKeys(now);
    if (expired.isEmpty()) {
      return 0;
    }
    for (AuthorizedKey key : expired) {
      for (ChatSession session : store.findByPublicKey(key.publicKeyBase64())) {
        if (session.isActive()) {
          deleteIdentityQuietly(session.externalIdentityId());
        } else {
          reconcile(session.externalIdentityId());
        }
      }
    }
    int removed = store.inTransaction(() -> {
      int count = 0;
      for (AuthorizedKey key : expired) {
        boolean stillExpired = store.loadKey(key.publicKeyBase64())
            .filter(k -> k.expiresAt().isBefore(now))
            .isPresent();
        if (stillExpired && store.deleteKey(key.publicKeyBase64())) {
          count++;
        }
      }
      return count;
    });
    log.info("Removed {} expired key(s)", removed);
    return removed;
  }

  /**
   * Deactivates every active session idle for longer than the session timeout, but only once
   * the homeserver confirmed deleting its identity. Sessions whose deletion failed stay active
   * and are retried next run.
   *
   * @return number of sessions deactivated
   */
  public int cleanupInactiveSessions() {
    Instant cutoff = clock.instant().minus(sessionTimeout);
    List<ChatSession> idle = store.findActiveIdleSince(cutoff);
    if (idle.isEmpty()) {
      return 0;
    }
    List<ChatSession> identityDeleted = new ArrayList<>();
    for (ChatSession session : idle) {
      if (deleteIdentityQuietly(session.externalIdentityId())) {
        identityDeleted.add(session);
      } else {
        log.warn("Keeping idle session {} active, identity {} not deleted",
            session.sessionId(), session.externalIdentityId());
      }
    }
    int deactivated = store.inTransaction(() -> {
      int count = 0;
      for (ChatSession session : identityDeleted) {
        Optional<ChatSession> current = store.loadSession(session.sessionId()).filter(ChatSession::isActive);
        if (current.isPresent()) {
          store.storeSession(current.get().deactivated());
          count++;
        }
      }
      return count;
    });
    log.info("Deactivated {} of {} idle session(s)", deactivated, idle.size());
    return deactivated;
  }

  /**
   * Reconciles every inactive session with the homeserver: an identity that still exists and
   * is not deactivated gets deleted. The local session row is deleted whatever the remote
   * outcome.
   *
   * @return number of identities the homeserver confirmed deleting
   */
  public int cleanupOrphanedIdentities() {
    List<ChatSession> inactive = store.findInactive();
    if (inactive.isEmpty()) {
      return 0;
    }
    int identitiesDeleted = 0;
    for (ChatSession session : inactive) {
      if (reconcile(session.externalIdentityId())) {
        identitiesDeleted++;
      }
    }
    int removed = store.inTransaction(() -> {
      int count = 0;
      for (ChatSession session : inactive) {
        boolean stillInactive = store.loadSession(session.sessionId())
            .filter(s -> !s.isActive())
            .isPresent();
        if (stillInactive && store.deleteSession(session.sessionId())) {
          count++;
        }
      }
      return count;
    });
    log.info("Deleted {} orphaned identity(s), removed {} inactive session(s)", identitiesDeleted, removed);
    return identitiesDeleted;
  }

  /**
   * Drops expired challenges from the cache.
   *
   * @return number of challenges removed
   */
  public int sweepChallenges() {
    int removed = challengeCache.sweep(clock.instant());
    if (removed > 0) {
      log.debug("Swept {} expired challenge(s)", removed);
    }
    return removed;
  }

  /**
   * Runs the three sweeps in dependency order: expired keys, idle sessions, orphans. A sweep
   * that fails counts as zero and does not stop the ones after it.
   *
   * @return the aggregate counts
   */
  public CleanupStats runFullCleanup() {
    Instant started = clock.instant();
    log.info("Starting full cleanup");
    int keys = guarded("expired keys", this::cleanupExpiredKeys);
    int sessions = guarded("inactive sessions", this::cleanupInactiveSessions);
    int orphans = guarded("orphaned identities", this::cleanupOrphanedIdentities);
    CleanupStats stats = new CleanupStats(started, keys, sessions, orphans);
    log.info("Full cleanup removed {} record(s)", stats.total());
    return stats;
  }

  private int guarded(String name, IntSupplier sweep) {
    try {
      return sweep.getAsInt();
    } catch (RuntimeException e) {
      log.error("Cleanup of {} failed", name, e);
      return 0;
    }
  }

  /**
   * @return true if a live identity was found and the homeserver confirmed deleting it
   */
  private boolean reconcile(String identityId) {
    try {
      Optional<IdentityStatus> status = provisioner.getIdentityStatus(identityId);
      if (status.isEmpty() || status.get().deactivated()) {
        return false;
      }
      log.info("Deleting orphaned identity {}", identityId);
      if (provisioner.deleteIdentity(identityId)) {
        return true;
      }
      log.warn("Orphaned identity {} could not be deleted", identityId);
    } catch (RuntimeException e) {
      log.warn("Reconciling identity {} failed: {}", identityId, e.getMessage());
    }
    return false;
  }

  private boolean deleteIdentityQuietly(String identityId) {
    try {
      return provisioner.deleteIdentity(identityId);
    } catch (RuntimeException e) {
      log.warn("Deleting identity {} failed: {}", identityId, e.getMessage());
      return false;
    }
  }
}
