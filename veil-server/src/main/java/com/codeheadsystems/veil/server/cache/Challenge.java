package com.codeheadsystems.veil.server.cache;

import java.time.Instant;

/**
 * An outstanding challenge.
 *
 * @param ownerKey  public key the challenge was issued for
 * @param nonce     base64 nonce the client must sign
 * @param expiresAt instant after which the challenge can no longer be taken
 */
public record Challenge(String ownerKey, String nonce, Instant expiresAt) {

  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public String toString() {
    return "Challenge[ownerKey=" + ownerKey + ", expiresAt=" + expiresAt + "]";
  }
}
