package com.codeheadsystems.veil.server.store;

import com.codeheadsystems.veil.server.model.ChatSession;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link ChatSession} records keyed by session id.
 * <p>
 * Implementations must be thread-safe. The public key of a session refers to an
 * {@link com.codeheadsystems.veil.server.model.AuthorizedKey} but the reference is not enforced.
 */
public interface ChatSessionStore {

  /**
   * Inserts or replaces a session.
   *
   * @param session the session
   * @throws com.codeheadsystems.veil.server.exception.StorageException if the session is rejected
   */
  void storeSession(ChatSession session);

  /**
   * @param sessionId the session id
   * @return the session, or empty if unknown
   */
  Optional<ChatSession> loadSession(String sessionId);

  /**
   * @param publicKeyBase64 the owning key
   * @return the most recently created active session for the key
   */
  Optional<ChatSession> findActiveByPublicKey(String publicKeyBase64);

  /**
   * @param publicKeyBase64 the owning key
   * @return every session of the key, any state
   */
  List<ChatSession> findByPublicKey(String publicKeyBase64);

  /**
   * @param cutoff the idle cutoff
   * @return every active session whose last activity is before {@code cutoff}
   */
  List<ChatSession> findActiveIdleSince(Instant cutoff);

  /**
   * @return every inactive session
   */
  List<ChatSession> findInactive();

  /**
   * Finds the most recently active session whose alias, public key or external identity id
   * equals the query.
   *
   * @param query exact value to match
   * @return the match among active sessions
   */
  Optional<ChatSession> findActiveByLookup(String query);

  /**
   * Hard-deletes a session.
   *
   * @param sessionId the session id
   * @return true if a session was removed
   */
  boolean deleteSession(String sessionId);
}
