package com.codeheadsystems.veil.server.model;

/**
 * Result of starting a session.
 *
 * @param session        the session, new or reused
 * @param identitySecret identity password, present only when the identity was created by this call
 * @param reused         true when an existing session was returned unchanged
 */
public record SessionDescriptor(ChatSession session, String identitySecret, boolean reused) {

  /**
   * The identity exists but no credential could be obtained for it.
   *
   * @return true if degraded
   */
  public boolean degraded() {
    return !session.hasUsableCredential();
  }

  @Override
  public String toString() {
    return "SessionDescriptor[session=" + session + ", reused=" + reused + "]";
  }
}
