package com.codeheadsystems.veil.model.key;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /keys/generate}
 *
 * @param count number of key pairs to generate, 1 to 100
 */
public record KeyGenerateRequest(@JsonProperty("count") int count) {
}
