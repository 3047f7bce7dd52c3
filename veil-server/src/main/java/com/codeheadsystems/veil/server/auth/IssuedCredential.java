package com.codeheadsystems.veil.server.auth;

import java.time.Instant;

/**
 * A freshly signed bearer credential.
 *
 * @param token     the compact JWT
 * @param issuedAt  the {@code iat} claim
 * @param expiresAt the {@code exp} claim
 */
public record IssuedCredential(String token, Instant issuedAt, Instant expiresAt) {

  @Override
  public String toString() {
    return "IssuedCredential[issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
  }
}
