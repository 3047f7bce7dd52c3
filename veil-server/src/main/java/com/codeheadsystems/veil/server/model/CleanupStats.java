package com.codeheadsystems.veil.server.model;

import java.time.Instant;

/**
 * Aggregate counts of a full cleanup run.
 *
 * @param timestamp                   when the run started
 * @param expiredKeysRemoved          keys hard-deleted
 * @param inactiveSessionsDeactivated idle sessions deactivated
 * @param orphanedIdentitiesRemoved   identities of inactive sessions the homeserver confirmed deleting
 */
public record CleanupStats(Instant timestamp,
                           int expiredKeysRemoved,
                           int inactiveSessionsDeactivated,
                           int orphanedIdentitiesRemoved) {

  public int total() {
    return expiredKeysRemoved + inactiveSessionsDeactivated + orphanedIdentitiesRemoved;
  }
}
