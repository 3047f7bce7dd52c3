package com.codeheadsystems.veil.server.model;

import java.time.Instant;

/**
 * Ties an authorized key to an identity provisioned on the homeserver.
 *
 * @param sessionId          unique generated id
 * @param publicKeyBase64    owning key
 * @param externalIdentityId identity id assigned by the provisioner
 * @param alias              display alias
 * @param credential         bearer credential for the identity, null when login failed
 * @param createdAt          creation instant
 * @param lastActivityAt     last read or heartbeat
 * @param state              lifecycle state
 */
public record ChatSession(String sessionId,
                          String publicKeyBase64,
                          String externalIdentityId,
                          String alias,
                          String credential,
                          Instant createdAt,
                          Instant lastActivityAt,
                          SessionState state) {

  public boolean isActive() {
    return state == SessionState.ACTIVE;
  }

  /**
   * A session without a credential cannot be handed back to a client and is superseded on the
   * next start.
   *
   * @return true if the credential is present and non-blank
   */
  public boolean hasUsableCredential() {
    return credential != null && !credential.isBlank();
  }

  public boolean isIdleSince(Instant cutoff) {
    return lastActivityAt.isBefore(cutoff);
  }

  public ChatSession withLastActivityAt(Instant instant) {
    return new ChatSession(sessionId, publicKeyBase64, externalIdentityId, alias, credential,
        createdAt, instant, state);
  }

  public ChatSession deactivated() {
    return new ChatSession(sessionId, publicKeyBase64, externalIdentityId, alias, credential,
        createdAt, lastActivityAt, SessionState.INACTIVE);
  }

  @Override
  public String toString() {
    return "ChatSession[sessionId=" + sessionId + ", externalIdentityId=" + externalIdentityId
        + ", alias=" + alias + ", state=" + state + "]";
  }
}
