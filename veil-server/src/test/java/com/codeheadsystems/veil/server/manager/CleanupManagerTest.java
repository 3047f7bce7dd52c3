package com.codeheadsystems.veil.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.veil.crypto.RandomProvider;
import com.codeheadsystems.veil.server.MutableClock;
import com.codeheadsystems.veil.server.cache.InMemoryChallengeCache;
import com.codeheadsystems.veil.server.exception.ProvisioningException;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import com.codeheadsystems.veil.server.model.ChatSession;
import com.codeheadsystems.veil.server.model.CleanupStats;
import com.codeheadsystems.veil.server.model.SessionState;
import com.codeheadsystems.veil.server.provisioning.IdentityProvisioner;
import com.codeheadsystems.veil.server.provisioning.IdentityStatus;
import com.codeheadsystems.veil.server.provisioning.InMemoryIdentityProvisioner;
import com.codeheadsystems.veil.server.store.InMemoryRecordStore;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CleanupManagerTest {

  private static final Duration SESSION_TIMEOUT = Duration.ofMinutes(60);

  @Mock private IdentityProvisioner provisioner;
  private MutableClock clock;
  private InMemoryRecordStore store;
  private InMemoryChallengeCache cache;
  private CleanupManager cleanupManager;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atDefaultStart();
    store = new InMemoryRecordStore();
    cache = new InMemoryChallengeCache(clock);
    cleanupManager = new CleanupManager(store, provisioner, cache, SESSION_TIMEOUT, clock);
  }

  @Test
  void cleanupExpiredKeys_isIdempotent() {
    Instant now = clock.instant();
    store.storeKey(AuthorizedKey.create("expired-1", now.minus(Duration.ofDays(8)), now.minusSeconds(60)));
    store.storeKey(AuthorizedKey.create("expired-2", now.minus(Duration.ofDays(8)), now.minusSeconds(1)).revoked());
    store.storeKey(AuthorizedKey.create("live", now, now.plus(Duration.ofDays(7))));

    assertThat(cleanupManager.cleanupExpiredKeys()).isEqualTo(2);
    assertThat(store.findExpiredKeys(clock.instant())).isEmpty();
    assertThat(cleanupManager.cleanupExpiredKeys()).isZero();
    assertThat(store.loadKey("live")).isPresent();
  }

  @Test
  void cleanupExpiredKeys_deletesActiveAndReconcilesEndedIdentitiesBeforeCascade() {
    Instant now = clock.instant();
    store.storeKey(AuthorizedKey.create("expired", now.minus(Duration.ofDays(8)), now.minusSeconds(1)));
    store.storeSession(session("active", "expired", SessionState.ACTIVE, now));
    store.storeSession(session("ended", "expired", SessionState.INACTIVE, now));
    store.storeSession(session("ended-gone", "expired", SessionState.INACTIVE, now));
    when(provisioner.deleteIdentity("@active:test")).thenReturn(false);
    when(provisioner.getIdentityStatus("@ended:test"))
        .thenReturn(Optional.of(new IdentityStatus("@ended:test", false)));
    when(provisioner.deleteIdentity("@ended:test")).thenReturn(true);
    when(provisioner.getIdentityStatus("@ended-gone:test")).thenReturn(Optional.empty());

    assertThat(cleanupManager.cleanupExpiredKeys()).isEqualTo(1);

    verify(provisioner).deleteIdentity("@active:test");
    verify(provisioner, never()).getIdentityStatus("@active:test");
    verify(provisioner).deleteIdentity("@ended:test");
    verify(provisioner, never()).deleteIdentity("@ended-gone:test");
    assertThat(store.findByPublicKey("expired")).isEmpty();
  }

  @Test
  void runFullCleanup_expiredKeyDoesNotStrandIdentityOfEndedSession() {
    InMemoryIdentityProvisioner homeserver = new InMemoryIdentityProvisioner(new RandomProvider(), "test");
    CleanupManager manager = new CleanupManager(store, homeserver, cache, SESSION_TIMEOUT, clock);
    String identityId = homeserver.createIdentity(new byte[]{1, 2, 3}, "SilentFox0042").identityId();
    Instant now = clock.instant();
    store.storeKey(AuthorizedKey.create("expired", now.minus(Duration.ofDays(8)), now.minusSeconds(1)));
    store.storeSession(new ChatSession("ended", "expired", identityId, "SilentFox0042", "credential",
        now, now, SessionState.INACTIVE));

    CleanupStats stats = manager.runFullCleanup();

    assertThat(stats.expiredKeysRemoved()).isEqualTo(1);
    assertThat(store.findByPublicKey("expired")).isEmpty();
    assertThat(homeserver.getIdentityStatus(identityId))
        .hasValueSatisfying(status -> assertThat(status.deactivated()).isTrue());
  }

  @Test
  void cleanupInactiveSessions_deactivatesWhenRemoteDeleteSucceeds() {
    store.storeSession(session("idle", "k", SessionState.ACTIVE, clock.instant()));
    clock.advance(SESSION_TIMEOUT.plusMinutes(1));
    when(provisioner.deleteIdentity("@idle:test")).thenReturn(true);

    assertThat(cleanupManager.cleanupInactiveSessions()).isEqualTo(1);

    assertThat(store.loadSession("idle").orElseThrow().isActive()).isFalse();
  }

  @Test
  void cleanupInactiveSessions_keepsSessionActiveWhenRemoteDeleteFails() {
    store.storeSession(session("idle", "k", SessionState.ACTIVE, clock.instant()));
    clock.advance(SESSION_TIMEOUT.plusMinutes(1));
    when(provisioner.deleteIdentity("@idle:test")).thenReturn(false);

    assertThat(cleanupManager.cleanupInactiveSessions()).isZero();

    assertThat(store.loadSession("idle").orElseThrow().isActive()).isTrue();
  }

  @Test
  void cleanupInactiveSessions_oneFailureDoesNotStopOthers() {
    store.storeSession(session("a", "k1", SessionState.ACTIVE, clock.instant()));
    store.storeSession(session("b", "k2", SessionState.ACTIVE, clock.instant()));
    clock.advance(SESSION_TIMEOUT.plusMinutes(1));
    when(provisioner.deleteIdentity("@a:test")).thenThrow(new IllegalStateException("timeout"));
    when(provisioner.deleteIdentity("@b:test")).thenReturn(true);

    assertThat(cleanupManager.cleanupInactiveSessions()).isEqualTo(1);

    assertThat(store.loadSession("a").orElseThrow().isActive()).isTrue();
    assertThat(store.loadSession("b").orElseThrow().isActive()).isFalse();
  }

  @Test
  void cleanupInactiveSessions_ignoresRecentSessions() {
    store.storeSession(session("recent", "k", SessionState.ACTIVE, clock.instant()));
    clock.advance(SESSION_TIMEOUT.minusMinutes(1));

    assertThat(cleanupManager.cleanupInactiveSessions()).isZero();
    verify(provisioner, never()).deleteIdentity(anyString());
  }

  @Test
  void cleanupOrphanedIdentities_deletesLiveRemoteIdentityAndLocalRow() {
    store.storeSession(session("live-remote", "k1", SessionState.INACTIVE, clock.instant()));
    store.storeSession(session("gone-remote", "k2", SessionState.INACTIVE, clock.instant()));
    store.storeSession(session("deactivated-remote", "k3", SessionState.INACTIVE, clock.instant()));
    store.storeSession(session("active", "k4", SessionState.ACTIVE, clock.instant()));
    when(provisioner.getIdentityStatus("@live-remote:test"))
        .thenReturn(Optional.of(new IdentityStatus("@live-remote:test", false)));
    when(provisioner.getIdentityStatus("@gone-remote:test")).thenReturn(Optional.empty());
    when(provisioner.getIdentityStatus("@deactivated-remote:test"))
        .thenReturn(Optional.of(new IdentityStatus("@deactivated-remote:test", true)));
    when(provisioner.deleteIdentity("@live-remote:test")).thenReturn(true);

    assertThat(cleanupManager.cleanupOrphanedIdentities()).isEqualTo(1);

    verify(provisioner).deleteIdentity("@live-remote:test");
    verify(provisioner, never()).deleteIdentity("@gone-remote:test");
    verify(provisioner, never()).deleteIdentity("@deactivated-remote:test");
    assertThat(store.findInactive()).isEmpty();
    assertThat(store.loadSession("active")).isPresent();
  }

  @Test
  void cleanupOrphanedIdentities_deletesLocalRowEvenWhenRemoteFails() {
    store.storeSession(session("orphan", "k", SessionState.INACTIVE, clock.instant()));
    when(provisioner.getIdentityStatus("@orphan:test")).thenThrow(new ProvisioningException("down"));

    assertThat(cleanupManager.cleanupOrphanedIdentities()).isZero();
    assertThat(store.loadSession("orphan")).isEmpty();
  }

  @Test
  void runFullCleanup_runsAllSweepsInOrder() {
    Instant now = clock.instant();
    store.storeKey(AuthorizedKey.create("expired", now.minus(Duration.ofDays(8)), now.plusSeconds(60)));
    store.storeSession(session("idle", "other", SessionState.ACTIVE, now));
    store.storeSession(session("ended", "third", SessionState.INACTIVE, now));
    clock.advance(SESSION_TIMEOUT.plusMinutes(1));
    when(provisioner.deleteIdentity("@idle:test")).thenReturn(true);
    when(provisioner.getIdentityStatus("@idle:test"))
        .thenReturn(Optional.of(new IdentityStatus("@idle:test", true)));
    when(provisioner.getIdentityStatus("@ended:test"))
        .thenReturn(Optional.of(new IdentityStatus("@ended:test", false)));
    when(provisioner.deleteIdentity("@ended:test")).thenReturn(true);

    CleanupStats stats = cleanupManager.runFullCleanup();

    // The idle session is deactivated by the second sweep and removed by the third.
    assertThat(stats.expiredKeysRemoved()).isEqualTo(1);
    assertThat(stats.inactiveSessionsDeactivated()).isEqualTo(1);
    assertThat(stats.orphanedIdentitiesRemoved()).isEqualTo(1);
    assertThat(stats.total()).isEqualTo(3);
    assertThat(stats.timestamp()).isEqualTo(clock.instant());
    assertThat(store.loadSession("idle")).isEmpty();
    assertThat(store.loadSession("ended")).isEmpty();
  }

  @Test
  void sweepChallenges_removesExpired() {
    cache.put("k", "nonce", Duration.ofMinutes(5));
    clock.advance(Duration.ofMinutes(6));

    assertThat(cleanupManager.sweepChallenges()).isEqualTo(1);
    assertThat(cache.size()).isZero();
  }

  private static ChatSession session(String id, String key, SessionState state, Instant lastActivity) {
    return new ChatSession(id, key, "@" + id + ":test", "Alias" + id, "credential",
        lastActivity, lastActivity, state);
  }
}
