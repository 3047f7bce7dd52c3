package com.codeheadsystems.veil.model.key;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code GET /keys/list} response
 *
 * @param count number of keys
 * @param keys  the keys, oldest first
 */
public record KeyListResponse(
    @JsonProperty("count") int count,
    @JsonProperty("keys") List<KeySummary> keys) {
}
