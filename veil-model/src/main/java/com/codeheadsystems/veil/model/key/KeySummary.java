package com.codeheadsystems.veil.model.key;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Public view of an authorized key.
 *
 * @param publicKeyBase64 base64-encoded public key
 * @param active          false once revoked
 * @param createdAt       ISO-8601 creation instant
 * @param expiresAt       ISO-8601 expiry instant
 * @param lastUsedAt      ISO-8601 instant of the last successful verification, or null
 */
public record KeySummary(
    @JsonProperty("public_key") String publicKeyBase64,
    @JsonProperty("is_active") boolean active,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("expires_at") String expiresAt,
    @JsonProperty("last_used_at") String lastUsedAt) {
}
