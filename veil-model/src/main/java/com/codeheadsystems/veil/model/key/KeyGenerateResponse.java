package com.codeheadsystems.veil.model.key;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Used by: {@code POST /keys/generate} response
 *
 * @param generated number of keys in {@code keys}
 * @param keys      the generated key pairs
 */
public record KeyGenerateResponse(
    @JsonProperty("generated") int generated,
    @JsonProperty("keys") List<GeneratedKey> keys) {
}
