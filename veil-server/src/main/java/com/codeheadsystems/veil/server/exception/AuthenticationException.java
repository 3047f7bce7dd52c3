package com.codeheadsystems.veil.server.exception;

/**
 * Any failure to authenticate a caller.
 * <p>
 * The {@link Reason} exists for server-side logging only. Callers outside the server must see a
 * single generic failure so that key existence and token state are not disclosed.
 */
public class AuthenticationException extends SecurityException {

  /**
   * Why authentication failed.
   */
  public enum Reason {
    /** Unknown, inactive or expired key. */
    NOT_AUTHORIZED,
    /** No live challenge for the key. */
    NO_ACTIVE_CHALLENGE,
    /** Signature did not verify against the challenge. */
    INVALID_SIGNATURE,
    /** Malformed, tampered or expired credential. */
    INVALID_CREDENTIAL
  }

  private final Reason reason;

  public AuthenticationException(Reason reason) {
    super("Authentication failed: " + reason);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
