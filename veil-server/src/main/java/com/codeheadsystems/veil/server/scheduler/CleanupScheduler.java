package com.codeheadsystems.veil.server.scheduler;

import com.codeheadsystems.veil.server.manager.CleanupManager;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the {@link CleanupManager} sweeps on fixed-rate timers, off the request threads.
 * <p>
 * Each task catches and logs its own failures; an exception escaping a fixed-rate task would
 * cancel every later run. Call {@link #shutdown()} on application stop. In Dropwizard, wrap
 * this in a {@code Managed} component.
 */
public class CleanupScheduler {

  private static final Logger log = LoggerFactory.getLogger(CleanupScheduler.class);

  private final CleanupManager cleanupManager;
  private final CleanupSchedule schedule;
  private final ScheduledExecutorService executor;

  public CleanupScheduler(CleanupManager cleanupManager, CleanupSchedule schedule) {
    this(cleanupManager, schedule, Executors.newScheduledThreadPool(2, daemonThreads()));
  }

  CleanupScheduler(CleanupManager cleanupManager, CleanupSchedule schedule,
                   ScheduledExecutorService executor) {
    this.cleanupManager = cleanupManager;
    this.schedule = schedule;
    this.executor = executor;
  }

  /**
   * Schedules the four tasks. The first run of each happens one period after start.
   */
  public void start() {
    log.info("Starting cleanup scheduler: {}", schedule);
    every(schedule.expiredKeys(), "expired-keys", cleanupManager::cleanupExpiredKeys);
    every(schedule.inactiveSessions(), "inactive-sessions", cleanupManager::cleanupInactiveSessions);
    every(schedule.orphans(), "orphaned-identities", cleanupManager::cleanupOrphanedIdentities);
    every(schedule.challenges(), "challenges", cleanupManager::sweepChallenges);
  }

  /**
   * Stops the timers and waits briefly for a running sweep to finish.
   */
  public void shutdown() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
    log.info("Cleanup scheduler stopped");
  }

  private void every(Duration period, String name, Runnable task) {
    long millis = period.toMillis();
    executor.scheduleAtFixedRate(() -> runSafely(name, task), millis, millis, TimeUnit.MILLISECONDS);
  }

  static void runSafely(String name, Runnable task) {
    try {
      task.run();
    } catch (RuntimeException e) {
      log.error("Scheduled cleanup task {} failed", name, e);
    }
  }

  private static ThreadFactory daemonThreads() {
    AtomicInteger counter = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, "veil-cleanup-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
