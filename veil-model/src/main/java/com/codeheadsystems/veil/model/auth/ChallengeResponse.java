package com.codeheadsystems.veil.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The nonce the client must sign. The signed message is the UTF-8 encoding of this exact string.
 * <p>
 * Used by: {@code POST /auth/challenge} response
 *
 * @param challenge base64-encoded 32 random bytes
 */
public record ChallengeResponse(@JsonProperty("challenge") String challenge) {
}
