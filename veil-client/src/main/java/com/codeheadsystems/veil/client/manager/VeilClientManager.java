package com.codeheadsystems.veil.client.manager;

import com.codeheadsystems.veil.client.accessor.VeilAccessor;
import com.codeheadsystems.veil.crypto.Ed25519Crypto;
import com.codeheadsystems.veil.model.auth.ChallengeRequest;
import com.codeheadsystems.veil.model.auth.ChallengeResponse;
import com.codeheadsystems.veil.model.auth.VerifyRequest;
import com.codeheadsystems.veil.model.auth.VerifyResponse;
import com.codeheadsystems.veil.model.session.SessionEndRequest;
import com.codeheadsystems.veil.model.session.SessionEndResponse;
import com.codeheadsystems.veil.model.session.SessionInfoResponse;
import com.codeheadsystems.veil.model.session.SessionStartResponse;
import com.codeheadsystems.veil.model.session.UserLookupRequest;
import com.codeheadsystems.veil.model.session.UserLookupResponse;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client side of the Veil protocol. Callers hold only a private key; the manager derives the
 * public key, runs the challenge-response login and then drives the session calls with the
 * resulting credential.
 * <p>
 * <strong>Login:</strong>
 * <ol>
 *   <li>Derive the public key and request a challenge for it.</li>
 *   <li>Sign the challenge string with the private key.</li>
 *   <li>Send the signature and receive a bearer credential.</li>
 * </ol>
 */
@Singleton
public class VeilClientManager {

  private static final Logger log = LoggerFactory.getLogger(VeilClientManager.class);

  private final Ed25519Crypto crypto;
  private final VeilAccessor accessor;

  @Inject
  public VeilClientManager(final Ed25519Crypto crypto, final VeilAccessor accessor) {
    log.info("VeilClientManager()");
    this.crypto = crypto;
    this.accessor = accessor;
  }

  /**
   * Logs in with a private key.
   *
   * @param privateKeyBase64 base64 32-byte Ed25519 seed
   * @return the credential and its expiry
   * @throws SecurityException        if the server rejects the key or the signature
   * @throws IllegalArgumentException if the private key is malformed
   */
  public VerifyResponse login(final String privateKeyBase64) {
    String publicKey = crypto.derivePublicKey(privateKeyBase64);
    log.debug("login()");

    ChallengeResponse challenge = accessor.challenge(new ChallengeRequest(publicKey));
    String signature = crypto.sign(challenge.challenge(), privateKeyBase64);
    return accessor.verify(new VerifyRequest(publicKey, signature));
  }

  public SessionStartResponse startSession(final String credential) {
    return accessor.startSession(credential);
  }

  public SessionInfoResponse sessionInfo(final String credential) {
    return accessor.sessionInfo(credential);
  }

  public SessionEndResponse endSession(final String credential, final String sessionId) {
    return accessor.endSession(credential, new SessionEndRequest(sessionId));
  }

  public UserLookupResponse lookup(final String credential, final String query) {
    return accessor.lookup(credential, new UserLookupRequest(query));
  }
}
