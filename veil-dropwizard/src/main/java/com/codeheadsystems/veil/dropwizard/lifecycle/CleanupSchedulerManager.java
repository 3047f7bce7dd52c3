package com.codeheadsystems.veil.dropwizard.lifecycle;

import com.codeheadsystems.veil.server.scheduler.CleanupScheduler;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the cleanup timers to the application lifecycle: started with the server, stopped before
 * it shuts down.
 */
public class CleanupSchedulerManager implements Managed {

  private final CleanupScheduler scheduler;

  public CleanupSchedulerManager(CleanupScheduler scheduler) {
    this.scheduler = scheduler;
  }

  @Override
  public void start() {
    scheduler.start();
  }

  @Override
  public void stop() {
    scheduler.shutdown();
  }
}
