package com.codeheadsystems.veil.model.admin;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate counts from a full cleanup run.
 * <p>
 * Used by: {@code POST /admin/cleanup} response
 *
 * @param timestamp                   ISO-8601 instant the run started
 * @param expiredKeysRemoved          authorized keys hard-deleted
 * @param inactiveSessionsDeactivated idle sessions whose identity was deleted and that were deactivated
 * @param orphanedIdentitiesRemoved   orphaned identities deleted on the homeserver
 * @param totalCleaned                sum of the three counts
 */
public record CleanupStatsResponse(
    @JsonProperty("timestamp") String timestamp,
    @JsonProperty("expired_keys_removed") int expiredKeysRemoved,
    @JsonProperty("inactive_sessions_deactivated") int inactiveSessionsDeactivated,
    @JsonProperty("orphaned_identities_removed") int orphanedIdentitiesRemoved,
    @JsonProperty("total_cleaned") int totalCleaned) {
}
