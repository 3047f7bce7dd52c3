package com.codeheadsystems.veil.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Bearer credential issued after a successful verification.
 * <p>
 * Used by: {@code POST /auth/verify} response
 *
 * @param token     signed JWT to send as {@code Authorization: Bearer <token>}
 * @param expiresAt ISO-8601 instant after which the token is rejected
 */
public record VerifyResponse(
    @JsonProperty("token") String token,
    @JsonProperty("expires_at") String expiresAt) {
}
