package com.codeheadsystems.veil.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /session/end} response
 *
 * @param sessionId       the ended session
 * @param identityDeleted whether the homeserver confirmed deletion of the identity
 */
public record SessionEndResponse(
    @JsonProperty("session_id") String sessionId,
    @JsonProperty("identity_deleted") boolean identityDeleted) {
}
