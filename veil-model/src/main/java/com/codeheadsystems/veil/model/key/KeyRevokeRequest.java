package com.codeheadsystems.veil.model.key;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Used by: {@code POST /keys/revoke}
 *
 * @param publicKeyBase64 the key to revoke
 */
public record KeyRevokeRequest(@JsonProperty("public_key") String publicKeyBase64) {
}
