package com.codeheadsystems.veil.server.manager;

import com.codeheadsystems.veil.crypto.RandomProvider;
import com.codeheadsystems.veil.server.alias.AliasGenerator;
import com.codeheadsystems.veil.server.exception.NoActiveSessionException;
import com.codeheadsystems.veil.server.exception.ProvisioningException;
import com.codeheadsystems.veil.server.model.ChatSession;
import com.codeheadsystems.veil.server.model.SessionDescriptor;
import com.codeheadsystems.veil.server.model.SessionState;
import com.codeheadsystems.veil.server.provisioning.IdentityProvisioner;
import com.codeheadsystems.veil.server.provisioning.ProvisionedIdentity;
import com.codeheadsystems.veil.server.store.RecordStore;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates, reuses and ends chat sessions for authenticated keys.
 * <p>
 * At most one active session exists per key. {@link #startSession(String)} holds a per-key lock
 * across its read-then-create sequence, so concurrent starts for one key provision a single
 * identity. Locks are striped: unrelated keys may share a stripe and wait on each other.
 * <p>
 * Provisioning happens before any local write. If it fails nothing is stored. If only the
 * follow-up login fails the session is stored without a credential and reported as degraded.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException}  - missing request data → HTTP 400</li>
 *   <li>{@link NoActiveSessionException}  - nothing to read or end → HTTP 404</li>
 *   <li>{@link ProvisioningException}     - identity could not be created → HTTP 500</li>
 *   <li>{@link com.codeheadsystems.veil.server.exception.StorageException} - store failure → HTTP 500</li>
 * </ul>
 */
public class SessionManager {

  private static final Logger log = LoggerFactory.getLogger(SessionManager.class);
  private static final int LOCK_STRIPES = 64;
  private static final int ALIAS_SALT_LENGTH = 16;

  private final RecordStore store;
  private final IdentityProvisioner provisioner;
  private final AliasGenerator aliasGenerator;
  private final RandomProvider randomProvider;
  private final Clock clock;
  private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

  public SessionManager(RecordStore store,
                        IdentityProvisioner provisioner,
                        AliasGenerator aliasGenerator,
                        RandomProvider randomProvider,
                        Clock clock) {
    this.store = store;
    this.provisioner = provisioner;
    this.aliasGenerator = aliasGenerator;
    this.randomProvider = randomProvider;
    this.clock = clock;
    for (int i = 0; i < LOCK_STRIPES; i++) {
      stripes[i] = new ReentrantLock();
    }
  }

  /**
   * @return the homeserver name identities are created on
   */
  public String serverName() {
    return provisioner.serverName();
  }

  /**
   * Returns the key's active session if it has a credential, otherwise provisions a new one.
   * An active session without a credential is deactivated first.
   *
   * @param publicKeyBase64 the authenticated key
   * @return the session descriptor
   * @throws ProvisioningException if the identity could not be created
   */
  public SessionDescriptor startSession(String publicKeyBase64) {
    AuthenticationManager.requireField(publicKeyBase64, "public_key");
    ReentrantLock lock = stripeFor(publicKeyBase64);
    lock.lock();
    try {
      Optional<ChatSession> existing = store.findActiveByPublicKey(publicKeyBase64);
      if (existing.isPresent()) {
        ChatSession session = existing.get();
        if (session.hasUsableCredential()) {
          log.debug("Reusing session {}", session.sessionId());
          return new SessionDescriptor(session, null, true);
        }
        log.warn("Superseding session {} that has no credential", session.sessionId());
        store.runInTransaction(() -> store.storeSession(session.deactivated()));
      }
      return createSession(publicKeyBase64);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the key's most recently created active session and records the read as activity.
   *
   * @param publicKeyBase64 the authenticated key
   * @return the session as stored after the update
   * @throws NoActiveSessionException if the key has no active session
   */
  public ChatSession getSessionInfo(String publicKeyBase64) {
    AuthenticationManager.requireField(publicKeyBase64, "public_key");
    Instant now = clock.instant();
    return store.inTransaction(() -> {
      ChatSession session = store.findActiveByPublicKey(publicKeyBase64)
          .orElseThrow(() -> new NoActiveSessionException("No active session"));
      ChatSession touched = session.withLastActivityAt(now);
      store.storeSession(touched);
      return touched;
    });
  }

  /**
   * Ends an active session owned by the caller. Deleting the remote identity is best effort;
   * the session is deactivated either way and an undeleted identity is reconciled later.
   *
   * @param sessionId       the session
   * @param publicKeyBase64 the authenticated key, must own the session
   * @return true if the homeserver confirmed the identity deletion
   * @throws NoActiveSessionException if no active session with that id belongs to the key
   */
  public boolean endSession(String sessionId, String publicKeyBase64) {
    AuthenticationManager.requireField(sessionId, "session_id");
    AuthenticationManager.requireField(publicKeyBase64, "public_key");
    ChatSession session = ownedActiveSession(sessionId, publicKeyBase64);

    boolean deleted = deleteIdentityQuietly(session.externalIdentityId());
    if (!deleted) {
      log.warn("Identity {} not deleted on session end, left for reconciliation",
          session.externalIdentityId());
    }
    store.runInTransaction(() -> {
      ChatSession current = ownedActiveSession(sessionId, publicKeyBase64);
      store.storeSession(current.deactivated());
    });
    log.info("Ended session {}", sessionId);
    return deleted;
  }

  /**
   * Finds the most recently active session whose alias, public key or identity id equals the
   * trimmed query.
   *
   * @param query the query
   * @return the match, or empty
   */
  public Optional<ChatSession> lookup(String query) {
    AuthenticationManager.requireField(query, "query");
    return store.findActiveByLookup(query.trim());
  }

  private SessionDescriptor createSession(String publicKeyBase64) {
    String sessionId = UUID.randomUUID().toString();
    Instant now = clock.instant();
    byte[] identitySeed = seed(publicKeyBase64, sessionId, now, new byte[0]);
    String alias = aliasGenerator.generate(
        seed(publicKeyBase64, sessionId, now, randomProvider.randomBytes(ALIAS_SALT_LENGTH)));

    ProvisionedIdentity identity;
    try {
      identity = provisioner.createIdentity(identitySeed, alias);
    } catch (ProvisioningException e) {
      log.error("Identity provisioning failed: {}", e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      log.error("Identity provisioning failed", e);
      throw new ProvisioningException("Identity provisioning failed", e);
    }

    String credential = authenticateQuietly(identity).orElse(null);
    if (credential == null) {
      log.warn("Identity {} created but login failed, session is degraded", identity.identityId());
    }

    ChatSession session = new ChatSession(sessionId, publicKeyBase64, identity.identityId(), alias,
        credential, now, now, SessionState.ACTIVE);
    try {
      store.runInTransaction(() -> store.storeSession(session));
    } catch (RuntimeException e) {
      log.error("Storing session {} failed, removing identity {}", sessionId, identity.identityId());
      deleteIdentityQuietly(identity.identityId());
      throw e;
    }
    log.info("Started session {} as {}", sessionId, alias);
    return new SessionDescriptor(session, identity.secret(), false);
  }

  private ChatSession ownedActiveSession(String sessionId, String publicKeyBase64) {
    return store.loadSession(sessionId)
        .filter(ChatSession::isActive)
        .filter(s -> s.publicKeyBase64().equals(publicKeyBase64))
        .orElseThrow(() -> new NoActiveSessionException("Session not found or already ended"));
  }

  private Optional<String> authenticateQuietly(ProvisionedIdentity identity) {
    try {
      return provisioner.authenticate(identity.identityId(), identity.secret());
    } catch (RuntimeException e) {
      log.warn("Login of identity {} failed: {}", identity.identityId(), e.getMessage());
      return Optional.empty();
    }
  }

  private boolean deleteIdentityQuietly(String identityId) {
    try {
      return provisioner.deleteIdentity(identityId);
    } catch (RuntimeException e) {
      log.warn("Deleting identity {} failed: {}", identityId, e.getMessage());
      return false;
    }
  }

  private ReentrantLock stripeFor(String publicKeyBase64) {
    return stripes[Math.floorMod(publicKeyBase64.hashCode(), LOCK_STRIPES)];
  }

  private static byte[] seed(String publicKeyBase64, String sessionId, Instant now, byte[] salt) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    out.writeBytes(publicKeyBase64.getBytes(StandardCharsets.UTF_8));
    out.writeBytes(sessionId.getBytes(StandardCharsets.UTF_8));
    out.writeBytes(Long.toString(now.toEpochMilli()).getBytes(StandardCharsets.UTF_8));
    out.writeBytes(salt);
    return out.toByteArray();
  }
}
