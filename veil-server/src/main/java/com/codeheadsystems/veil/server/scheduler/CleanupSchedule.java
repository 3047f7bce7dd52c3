package com.codeheadsystems.veil.server.scheduler;

import java.time.Duration;

/**
 * Cadences of the periodic cleanup tasks.
 *
 * @param expiredKeys      expired-key sweep period
 * @param inactiveSessions idle-session sweep period
 * @param orphans          orphan reconciliation period
 * @param challenges       challenge cache sweep period
 */
public record CleanupSchedule(Duration expiredKeys,
                              Duration inactiveSessions,
                              Duration orphans,
                              Duration challenges) {

  /**
   * Hourly, half-hourly, daily and every minute.
   */
  public static final CleanupSchedule DEFAULT = new CleanupSchedule(
      Duration.ofHours(1), Duration.ofMinutes(30), Duration.ofDays(1), Duration.ofMinutes(1));

  public CleanupSchedule {
    requirePositive(expiredKeys, "expiredKeys");
    requirePositive(inactiveSessions, "inactiveSessions");
    requirePositive(orphans, "orphans");
    requirePositive(challenges, "challenges");
  }

  private static void requirePositive(Duration period, String name) {
    if (period == null || period.isNegative() || period.isZero()) {
      throw new IllegalArgumentException(name + " period must be positive");
    }
  }
}
