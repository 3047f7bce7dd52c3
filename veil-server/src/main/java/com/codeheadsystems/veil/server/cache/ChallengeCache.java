package com.codeheadsystems.veil.server.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Time-bounded map from a key identity to its single outstanding challenge.
 * <p>
 * Implementations must be thread-safe and atomic per key. No ordering across keys is required.
 * The in-process implementation is not shared between server instances; a horizontally scaled
 * deployment needs an implementation over a shared store.
 */
public interface ChallengeCache {

  /**
   * Stores a challenge for a key, replacing any unconsumed challenge it already had.
   *
   * @param ownerKey the key identity
   * @param nonce    the nonce
   * @param ttl      how long the challenge stays takeable
   * @return the stored challenge
   * @throws IllegalStateException if the cache is at capacity after sweeping expired entries
   */
  Challenge put(String ownerKey, String nonce, Duration ttl);

  /**
   * Atomically removes the challenge for a key and returns it if it had not expired. An expired
   * entry is removed as well. A challenge can be taken at most once.
   *
   * @param ownerKey the key identity
   * @return the live nonce, or empty
   */
  Optional<String> take(String ownerKey);

  /**
   * Discards any challenge for a key without returning it.
   *
   * @param ownerKey the key identity
   */
  void remove(String ownerKey);

  /**
   * Removes every entry that has expired at {@code now}.
   *
   * @param now the reference instant
   * @return the number of entries removed
   */
  int sweep(Instant now);

  /**
   * @return the number of entries currently held, expired or not
   */
  int size();

  /**
   * @return the maximum number of entries
   */
  int capacity();
}
