package com.codeheadsystems.veil.server.store;

import com.codeheadsystems.veil.server.exception.StorageException;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import com.codeheadsystems.veil.server.model.ChatSession;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link RecordStore} guarded by a single {@link ReentrantLock}.
 * <p>
 * Transactions are serialized; rollback restores a snapshot taken when the outermost
 * transaction began. Writes of records missing a primary key or a required field are rejected
 * with a {@link StorageException}. All records are lost on restart. Suitable for development and
 * testing only.
 */
public class InMemoryRecordStore implements RecordStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, AuthorizedKey> keys = new HashMap<>();
  private final Map<String, ChatSession> sessions = new HashMap<>();

  public InMemoryRecordStore() {
    log.warn("Using in-memory record store: keys and sessions are lost on restart");
  }

  @Override
  public <T> T inTransaction(Supplier<T> work) {
    lock.lock();
    try {
      if (lock.getHoldCount() > 1) {
        return work.get();
      }
      Map<String, AuthorizedKey> keySnapshot = new HashMap<>(keys);
      Map<String, ChatSession> sessionSnapshot = new HashMap<>(sessions);
      try {
        return work.get();
      } catch (RuntimeException e) {
        keys.clear();
        keys.putAll(keySnapshot);
        sessions.clear();
        sessions.putAll(sessionSnapshot);
        log.debug("Transaction rolled back: {}", e.getClass().getSimpleName());
        throw e;
      }
    } finally {
      lock.unlock();
    }
  }

  // ── Keys ─────────────────────────────────────────────────────────────────

  @Override
  public void storeKey(AuthorizedKey key) {
    require(key != null, "key", "record");
    require(notBlank(key.publicKeyBase64()), "key", "public_key");
    require(key.createdAt() != null, "key", "created_at");
    require(key.expiresAt() != null, "key", "expires_at");
    locked(() -> keys.put(key.publicKeyBase64(), key));
  }

  @Override
  public Optional<AuthorizedKey> loadKey(String publicKeyBase64) {
    if (publicKeyBase64 == null) {
      return Optional.empty();
    }
    return locked(() -> Optional.ofNullable(keys.get(publicKeyBase64)));
  }

  @Override
  public List<AuthorizedKey> listKeys() {
    return locked(() -> keys.values().stream()
        .sorted(Comparator.comparing(AuthorizedKey::createdAt))
        .collect(Collectors.toList()));
  }

  @Override
  public List<AuthorizedKey> findExpiredKeys(Instant now) {
    return locked(() -> keys.values().stream()
        .filter(k -> k.expiresAt().isBefore(now))
        .collect(Collectors.toList()));
  }

  @Override
  public boolean deleteKey(String publicKeyBase64) {
    return locked(() -> {
      if (keys.remove(publicKeyBase64) == null) {
        return false;
      }
      sessions.values().removeIf(s -> s.publicKeyBase64().equals(publicKeyBase64));
      return true;
    });
  }

  // ── Sessions ─────────────────────────────────────────────────────────────

  @Override
  public void storeSession(ChatSession session) {
    require(session != null, "session", "record");
    require(notBlank(session.sessionId()), "session", "session_id");
    require(notBlank(session.publicKeyBase64()), "session", "public_key");
    require(notBlank(session.externalIdentityId()), "session", "external_identity_id");
    require(session.createdAt() != null, "session", "created_at");
    require(session.lastActivityAt() != null, "session", "last_activity_at");
    require(session.state() != null, "session", "state");
    locked(() -> sessions.put(session.sessionId(), session));
  }

  @Override
  public Optional<ChatSession> loadSession(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    return locked(() -> Optional.ofNullable(sessions.get(sessionId)));
  }

  @Override
  public Optional<ChatSession> findActiveByPublicKey(String publicKeyBase64) {
    return locked(() -> sessions.values().stream()
        .filter(ChatSession::isActive)
        .filter(s -> s.publicKeyBase64().equals(publicKeyBase64))
        .max(Comparator.comparing(ChatSession::createdAt)));
  }

  @Override
  public List<ChatSession> findByPublicKey(String publicKeyBase64) {
    return select(s -> s.publicKeyBase64().equals(publicKeyBase64));
  }

  @Override
  public List<ChatSession> findActiveIdleSince(Instant cutoff) {
    return select(s -> s.isActive() && s.isIdleSince(cutoff));
  }

  @Override
  public List<ChatSession> findInactive() {
    return select(s -> !s.isActive());
  }

  @Override
  public Optional<ChatSession> findActiveByLookup(String query) {
    return locked(() -> sessions.values().stream()
        .filter(ChatSession::isActive)
        .filter(s -> query.equals(s.alias())
            || query.equals(s.publicKeyBase64())
            || query.equals(s.externalIdentityId()))
        .max(Comparator.comparing(ChatSession::lastActivityAt)));
  }

  @Override
  public boolean deleteSession(String sessionId) {
    return locked(() -> sessions.remove(sessionId) != null);
  }

  private List<ChatSession> select(Predicate<ChatSession> predicate) {
    return locked(() -> sessions.values().stream()
        .filter(predicate)
        .sorted(Comparator.comparing(ChatSession::createdAt))
        .collect(Collectors.toList()));
  }

  private static void require(boolean present, String record, String field) {
    if (!present) {
      throw new StorageException("Rejected " + record + " record: missing " + field);
    }
  }

  private static boolean notBlank(String value) {
    return value != null && !value.isBlank();
  }

  private <T> T locked(Supplier<T> work) {
    lock.lock();
    try {
      return work.get();
    } finally {
      lock.unlock();
    }
  }
}
