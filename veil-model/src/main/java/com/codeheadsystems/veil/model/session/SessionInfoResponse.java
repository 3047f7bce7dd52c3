package com.codeheadsystems.veil.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code GET /session/info} response
 *
 * @param sessionId          unique session id
 * @param alias              display alias
 * @param externalIdentityId homeserver user id
 * @param createdAt          ISO-8601 creation instant
 * @param lastActivityAt     ISO-8601 instant of this read
 * @param active             always true for a returned session
 */
public record SessionInfoResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("alias") String alias,
    @JsonProperty("external_identity_id") String externalIdentityId,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("last_activity_at") String lastActivityAt,
    @JsonProperty("is_active") boolean active) {
}
