package com.codeheadsystems.veil.server.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ChallengeCache} backed by a {@link ConcurrentHashMap}.
 * <p>
 * Capacity is enforced on insert. When full, expired entries are swept first; if the cache is
 * still full the insert is refused, bounding memory under a flood of unanswered challenges.
 */
public class InMemoryChallengeCache implements ChallengeCache {

  /**
   * Default maximum number of outstanding challenges.
   */
  public static final int DEFAULT_CAPACITY = 10_000;

  private static final Logger log = LoggerFactory.getLogger(InMemoryChallengeCache.class);

  private final ConcurrentHashMap<String, Challenge> challenges = new ConcurrentHashMap<>();
  private final Clock clock;
  private final int capacity;

  public InMemoryChallengeCache(Clock clock) {
    this(clock, DEFAULT_CAPACITY);
  }

  public InMemoryChallengeCache(Clock clock, int capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.clock = clock;
    this.capacity = capacity;
  }

  @Override
  public Challenge put(String ownerKey, String nonce, Duration ttl) {
    Instant now = clock.instant();
    if (!challenges.containsKey(ownerKey) && challenges.size() >= capacity) {
      int swept = sweep(now);
      log.debug("Challenge cache at capacity, swept {} expired entries", swept);
      if (challenges.size() >= capacity) {
        log.warn("Challenge cache full ({} entries), refusing new challenge", capacity);
        throw new IllegalStateException("Too many pending challenges");
      }
    }
    Challenge challenge = new Challenge(ownerKey, nonce, now.plus(ttl));
    challenges.put(ownerKey, challenge);
    return challenge;
  }

  @Override
  public Optional<String> take(String ownerKey) {
    if (ownerKey == null) {
      return Optional.empty();
    }
    Challenge challenge = challenges.remove(ownerKey);
    if (challenge == null) {
      return Optional.empty();
    }
    if (challenge.isExpired(clock.instant())) {
      log.debug("Challenge for key expired at {}", challenge.expiresAt());
      return Optional.empty();
    }
    return Optional.of(challenge.nonce());
  }

  @Override
  public void remove(String ownerKey) {
    challenges.remove(ownerKey);
  }

  @Override
  public int sweep(Instant now) {
    int removed = 0;
    for (Map.Entry<String, Challenge> entry : challenges.entrySet()) {
      // remove(key, value) leaves a challenge re-issued since the read in place
      if (entry.getValue().isExpired(now) && challenges.remove(entry.getKey(), entry.getValue())) {
        removed++;
      }
    }
    return removed;
  }

  @Override
  public int size() {
    return challenges.size();
  }

  @Override
  public int capacity() {
    return capacity;
  }
}
