package com.codeheadsystems.veil.server.store;

import com.codeheadsystems.veil.server.model.AuthorizedKey;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Storage for {@link AuthorizedKey} records keyed by public key.
 * <p>
 * Implementations must be thread-safe.
 */
public interface AuthorizedKeyStore {

  /**
   * Inserts or replaces a key.
   *
   * @param key the key
   * @throws com.codeheadsystems.veil.server.exception.StorageException if the key is rejected
   */
  void storeKey(AuthorizedKey key);

  /**
   * @param publicKeyBase64 the public key
   * @return the key, or empty if unknown
   */
  Optional<AuthorizedKey> loadKey(String publicKeyBase64);

  /**
   * @return every key, oldest first
   */
  List<AuthorizedKey> listKeys();

  /**
   * @param now the reference instant
   * @return every key whose expiry is before {@code now}, active or not
   */
  List<AuthorizedKey> findExpiredKeys(Instant now);

  /**
   * Hard-deletes a key. Sessions owned by the key are deleted with it.
   *
   * @param publicKeyBase64 the public key
   * @return true if a key was removed
   */
  boolean deleteKey(String publicKeyBase64);
}
