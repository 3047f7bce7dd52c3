package com.codeheadsystems.veil.server.manager;

import com.codeheadsystems.veil.crypto.Ed25519Crypto;
import com.codeheadsystems.veil.server.auth.CredentialManager;
import com.codeheadsystems.veil.server.auth.IssuedCredential;
import com.codeheadsystems.veil.server.cache.ChallengeCache;
import com.codeheadsystems.veil.server.exception.AuthenticationException;
import com.codeheadsystems.veil.server.exception.AuthenticationException.Reason;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import com.codeheadsystems.veil.server.store.RecordStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Framework-agnostic challenge-response authentication.
 * <p>
 * Per key the protocol moves {@code NoChallenge -> ChallengeIssued -> Verified | Rejected |
 * Expired}. The state is never persisted; it is inferred from the {@link ChallengeCache} and the
 * key record. A nonce is consumed by the first verification attempt, successful or not.
 * <p>
 * <strong>Exception contract</strong> (callers should map these to HTTP responses):
 * <ul>
 *   <li>{@link IllegalArgumentException} - missing request data → HTTP 400</li>
 *   <li>{@link AuthenticationException}  - any authentication failure → HTTP 401, generic body</li>
 *   <li>{@link IllegalStateException}    - challenge cache at capacity → HTTP 503</li>
 * </ul>
 */
public class AuthenticationManager {

  private static final Logger log = LoggerFactory.getLogger(AuthenticationManager.class);

  private final Ed25519Crypto crypto;
  private final ChallengeCache challengeCache;
  private final RecordStore store;
  private final CredentialManager credentialManager;
  private final Duration challengeTtl;
  private final Clock clock;

  public AuthenticationManager(Ed25519Crypto crypto,
                               ChallengeCache challengeCache,
                               RecordStore store,
                               CredentialManager credentialManager,
                               Duration challengeTtl,
                               Clock clock) {
    this.crypto = crypto;
    this.challengeCache = challengeCache;
    this.store = store;
    this.credentialManager = credentialManager;
    this.challengeTtl = challengeTtl;
    this.clock = clock;
  }

  /**
   * Issues a fresh nonce for a usable key, replacing any outstanding one.
   *
   * @param publicKeyBase64 the key
   * @return the nonce to sign
   * @throws AuthenticationException with {@link Reason#NOT_AUTHORIZED} for an unknown, revoked
   *                                 or expired key
   */
  public String requestChallenge(String publicKeyBase64) {
    requireField(publicKeyBase64, "public_key");
    requireUsableKey(publicKeyBase64);
    String nonce = crypto.createChallenge();
    challengeCache.put(publicKeyBase64, nonce, challengeTtl);
    log.debug("Issued challenge");
    return nonce;
  }

  /**
   * Verifies a signature over the outstanding nonce and issues a credential.
   *
   * @param publicKeyBase64 the key
   * @param signatureBase64 signature over the UTF-8 bytes of the nonce
   * @return the credential
   * @throws AuthenticationException with {@link Reason#NO_ACTIVE_CHALLENGE},
   *                                 {@link Reason#INVALID_SIGNATURE} or
   *                                 {@link Reason#NOT_AUTHORIZED}
   */
  public IssuedCredential verifyChallenge(String publicKeyBase64, String signatureBase64) {
    requireField(publicKeyBase64, "public_key");
    requireField(signatureBase64, "signature");
    String nonce = challengeCache.take(publicKeyBase64)
        .orElseThrow(() -> fail(Reason.NO_ACTIVE_CHALLENGE));
    if (!crypto.verifySignature(nonce, signatureBase64, publicKeyBase64)) {
      throw fail(Reason.INVALID_SIGNATURE);
    }
    Instant now = clock.instant();
    // The key may have been revoked or deleted while the challenge was outstanding.
    store.runInTransaction(() -> {
      AuthorizedKey key = store.loadKey(publicKeyBase64)
          .filter(k -> k.isUsable(now))
          .orElseThrow(() -> fail(Reason.NOT_AUTHORIZED));
      store.storeKey(key.withLastUsedAt(now));
    });
    IssuedCredential credential = credentialManager.issue(publicKeyBase64);
    log.info("Key verified, credential expires {}", credential.expiresAt());
    return credential;
  }

  /**
   * Resolves a bearer credential to the key it was issued for. The key must still be usable.
   *
   * @param token the credential, may be null
   * @return the public key
   * @throws AuthenticationException with {@link Reason#INVALID_CREDENTIAL}
   */
  public String validateCredential(String token) {
    String publicKey = credentialManager.validate(token)
        .orElseThrow(() -> fail(Reason.INVALID_CREDENTIAL));
    Instant now = clock.instant();
    if (store.loadKey(publicKey).filter(k -> k.isUsable(now)).isEmpty()) {
      throw fail(Reason.INVALID_CREDENTIAL);
    }
    return publicKey;
  }

  private void requireUsableKey(String publicKeyBase64) {
    Instant now = clock.instant();
    if (store.loadKey(publicKeyBase64).filter(k -> k.isUsable(now)).isEmpty()) {
      throw fail(Reason.NOT_AUTHORIZED);
    }
  }

  private static AuthenticationException fail(Reason reason) {
    log.debug("Authentication rejected: {}", reason);
    return new AuthenticationException(reason);
  }

  static void requireField(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Missing required field: " + name);
    }
  }
}
