package com.codeheadsystems.veil.model.auth;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Proves possession of the private key by returning a signature over the outstanding challenge.
 * <p>
 * Used by: {@code POST /auth/verify}
 *
 * @param publicKeyBase64 base64-encoded public key the challenge was issued for
 * @param signatureBase64 base64-encoded 64-byte Ed25519 signature over the challenge string
 */
public record VerifyRequest(
    @JsonProperty("public_key") String publicKeyBase64,
    @JsonProperty("signature") String signatureBase64) {
}
