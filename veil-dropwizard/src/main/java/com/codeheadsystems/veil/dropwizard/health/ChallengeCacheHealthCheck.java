package com.codeheadsystems.veil.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.veil.server.cache.ChallengeCache;

/**
 * Unhealthy while the challenge cache is full and new logins are being refused.
 */
public class ChallengeCacheHealthCheck extends HealthCheck {

  private final ChallengeCache challengeCache;

  public ChallengeCacheHealthCheck(ChallengeCache challengeCache) {
    this.challengeCache = challengeCache;
  }

  @Override
  protected Result check() {
    int size = challengeCache.size();
    int capacity = challengeCache.capacity();
    if (size >= capacity) {
      return Result.unhealthy("Challenge cache full: %d of %d", size, capacity);
    }
    return Result.healthy("pending challenges=%d of %d", size, capacity);
  }
}
