package com.codeheadsystems.veil.model.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /session/end}
 *
 * @param sessionId id of an active session owned by the caller
 */
public record SessionEndRequest(@JsonProperty("session_id") String sessionId) {
}
