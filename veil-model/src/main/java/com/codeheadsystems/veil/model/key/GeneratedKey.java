package com.codeheadsystems.veil.model.key;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A newly authorized key pair. The private half is never stored by the server.
 *
 * @param publicKeyBase64  base64-encoded public key
 * @param privateKeyBase64 base64-encoded private seed
 * @param expiresAt        ISO-8601 expiry of the authorization
 */
public record GeneratedKey(
    @JsonProperty("public_key") String publicKeyBase64,
    @JsonProperty("private_key") String privateKeyBase64,
    @JsonProperty("expires_at") String expiresAt) {

  @Override
  public String toString() {
    return "GeneratedKey[publicKeyBase64=" + publicKeyBase64 + ", expiresAt=" + expiresAt + "]";
  }
}
