package com.codeheadsystems.veil.server.model;

import java.time.Instant;
import java.util.Optional;

/**
 * A public key that is allowed to authenticate.
 * <p>
 * A key is usable iff it is active and not expired. {@code lastUsedAt} is null until the first
 * successful verification.
 *
 * @param publicKeyBase64 base64-encoded raw public key, the natural primary key
 * @param createdAt       creation instant
 * @param expiresAt       instant after which the key is expired
 * @param active          false once revoked
 * @param lastUsedAt      instant of the last successful verification, or null
 */
public record AuthorizedKey(String publicKeyBase64,
                            Instant createdAt,
                            Instant expiresAt,
                            boolean active,
                            Instant lastUsedAt) {

  /**
   * Creates an active, never-used key.
   *
   * @param publicKeyBase64 the public key
   * @param createdAt       creation instant
   * @param expiresAt       expiry instant
   * @return the key
   */
  public static AuthorizedKey create(String publicKeyBase64, Instant createdAt, Instant expiresAt) {
    return new AuthorizedKey(publicKeyBase64, createdAt, expiresAt, true, null);
  }

  public boolean isExpired(Instant now) {
    return now.isAfter(expiresAt);
  }

  public boolean isUsable(Instant now) {
    return active && !isExpired(now);
  }

  public Optional<Instant> lastUsed() {
    return Optional.ofNullable(lastUsedAt);
  }

  public AuthorizedKey withLastUsedAt(Instant instant) {
    return new AuthorizedKey(publicKeyBase64, createdAt, expiresAt, active, instant);
  }

  public AuthorizedKey revoked() {
    return new AuthorizedKey(publicKeyBase64, createdAt, expiresAt, false, lastUsedAt);
  }
}
