package com.codeheadsystems.veil.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Asks the server for a challenge nonce bound to an authorized public key.
 * <p>
 * Used by: {@code POST /auth/challenge}
 *
 * @param publicKeyBase64 base64-encoded raw 32-byte Ed25519 public key
 */
public record ChallengeRequest(@JsonProperty("public_key") String publicKeyBase64) {
}
