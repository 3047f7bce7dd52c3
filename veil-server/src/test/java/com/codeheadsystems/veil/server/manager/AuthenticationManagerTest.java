package com.codeheadsystems.veil.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.crypto.Ed25519Crypto;
import com.codeheadsystems.veil.crypto.Ed25519KeyPair;
import com.codeheadsystems.veil.server.MutableClock;
import com.codeheadsystems.veil.server.auth.CredentialManager;
import com.codeheadsystems.veil.server.auth.IssuedCredential;
import com.codeheadsystems.veil.server.cache.InMemoryChallengeCache;
import com.codeheadsystems.veil.server.exception.AuthenticationException;
import com.codeheadsystems.veil.server.exception.AuthenticationException.Reason;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import com.codeheadsystems.veil.server.store.InMemoryRecordStore;
import java.time.Duration;
import java.util.Base64;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AuthenticationManagerTest {

  private static final Duration CHALLENGE_TTL = Duration.ofMinutes(5);
  private static final Duration CREDENTIAL_TTL = Duration.ofHours(24);

  private final Ed25519Crypto crypto = new Ed25519Crypto();
  private MutableClock clock;
  private InMemoryRecordStore store;
  private InMemoryChallengeCache cache;
  private AuthenticationManager manager;
  private Ed25519KeyPair keyPair;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atDefaultStart();
    store = new InMemoryRecordStore();
    cache = new InMemoryChallengeCache(clock);
    CredentialManager credentialManager =
        new CredentialManager(new byte[32], "veil", CREDENTIAL_TTL, clock);
    manager = new AuthenticationManager(crypto, cache, store, credentialManager, CHALLENGE_TTL, clock);
    keyPair = crypto.generateKeyPair();
    store.storeKey(AuthorizedKey.create(keyPair.publicKeyBase64(), clock.instant(),
        clock.instant().plus(Duration.ofDays(7))));
  }

  @Test
  void fullFlow_issuesCredentialValidFor24Hours() {
    String nonce = manager.requestChallenge(keyPair.publicKeyBase64());
    assertThat(nonce).hasSize(44);
    assertThat(Base64.getDecoder().decode(nonce)).hasSize(32);

    String signature = crypto.sign(nonce, keyPair.privateKeyBase64());
    IssuedCredential credential = manager.verifyChallenge(keyPair.publicKeyBase64(), signature);

    assertThat(credential.expiresAt()).isEqualTo(credential.issuedAt().plus(CREDENTIAL_TTL));
    assertThat(manager.validateCredential(credential.token())).isEqualTo(keyPair.publicKeyBase64());
    assertThat(store.loadKey(keyPair.publicKeyBase64()).orElseThrow().lastUsedAt())
        .isEqualTo(clock.instant());

    clock.advance(CREDENTIAL_TTL.minusMinutes(1));
    assertThat(manager.validateCredential(credential.token())).isEqualTo(keyPair.publicKeyBase64());
    clock.advance(Duration.ofMinutes(2));
    assertReason(() -> manager.validateCredential(credential.token()), Reason.INVALID_CREDENTIAL);
  }

  @Test
  void verify_successfulNonceCannotBeReplayed() {
    String nonce = manager.requestChallenge(keyPair.publicKeyBase64());
    String signature = crypto.sign(nonce, keyPair.privateKeyBase64());
    manager.verifyChallenge(keyPair.publicKeyBase64(), signature);

    assertReason(() -> manager.verifyChallenge(keyPair.publicKeyBase64(), signature),
        Reason.NO_ACTIVE_CHALLENGE);
  }

  @Test
  void verify_failedAttemptStillConsumesNonce() {
    String nonce = manager.requestChallenge(keyPair.publicKeyBase64());
    String badSignature = crypto.sign(nonce + "tampered", keyPair.privateKeyBase64());

    assertReason(() -> manager.verifyChallenge(keyPair.publicKeyBase64(), badSignature),
        Reason.INVALID_SIGNATURE);

    String goodSignature = crypto.sign(nonce, keyPair.privateKeyBase64());
    assertReason(() -> manager.verifyChallenge(keyPair.publicKeyBase64(), goodSignature),
        Reason.NO_ACTIVE_CHALLENGE);
  }

  @Test
  void verify_newChallengeInvalidatesOld() {
    String first = manager.requestChallenge(keyPair.publicKeyBase64());
    manager.requestChallenge(keyPair.publicKeyBase64());

    assertReason(() -> manager.verifyChallenge(keyPair.publicKeyBase64(),
        crypto.sign(first, keyPair.privateKeyBase64())), Reason.INVALID_SIGNATURE);
  }

  @Test
  void verify_expiredChallenge_isRejected() {
    String nonce = manager.requestChallenge(keyPair.publicKeyBase64());
    clock.advance(CHALLENGE_TTL.plusSeconds(1));

    assertReason(() -> manager.verifyChallenge(keyPair.publicKeyBase64(),
        crypto.sign(nonce, keyPair.privateKeyBase64())), Reason.NO_ACTIVE_CHALLENGE);
  }

  @Test
  void verify_withoutChallenge_isRejected() {
    assertReason(() -> manager.verifyChallenge(keyPair.publicKeyBase64(),
        crypto.sign("anything", keyPair.privateKeyBase64())), Reason.NO_ACTIVE_CHALLENGE);
  }

  @Test
  void requestChallenge_unknownKey_isNotAuthorized() {
    assertReason(() -> manager.requestChallenge(crypto.generateKeyPair().publicKeyBase64()),
        Reason.NOT_AUTHORIZED);
  }

  @Test
  void requestChallenge_revokedKey_isNotAuthorized() {
    store.storeKey(store.loadKey(keyPair.publicKeyBase64()).orElseThrow().revoked());

    assertReason(() -> manager.requestChallenge(keyPair.publicKeyBase64()), Reason.NOT_AUTHORIZED);
  }

  @Test
  void requestChallenge_expiredKey_isNotAuthorized() {
    clock.advance(Duration.ofDays(7).plusSeconds(1));

    assertReason(() -> manager.requestChallenge(keyPair.publicKeyBase64()), Reason.NOT_AUTHORIZED);
  }

  @Test
  void verify_keyRevokedWhileChallengeOutstanding_isNotAuthorized() {
    String nonce = manager.requestChallenge(keyPair.publicKeyBase64());
    store.storeKey(store.loadKey(keyPair.publicKeyBase64()).orElseThrow().revoked());

    assertReason(() -> manager.verifyChallenge(keyPair.publicKeyBase64(),
        crypto.sign(nonce, keyPair.privateKeyBase64())), Reason.NOT_AUTHORIZED);
    assertThat(store.loadKey(keyPair.publicKeyBase64()).orElseThrow().lastUsedAt()).isNull();
  }

  @Test
  void validateCredential_revokedKey_isInvalid() {
    String nonce = manager.requestChallenge(keyPair.publicKeyBase64());
    String token = manager.verifyChallenge(keyPair.publicKeyBase64(),
        crypto.sign(nonce, keyPair.privateKeyBase64())).token();
    store.storeKey(store.loadKey(keyPair.publicKeyBase64()).orElseThrow().revoked());

    assertReason(() -> manager.validateCredential(token), Reason.INVALID_CREDENTIAL);
  }

  @Test
  void validateCredential_garbage_isInvalid() {
    assertReason(() -> manager.validateCredential("garbage"), Reason.INVALID_CREDENTIAL);
    assertReason(() -> manager.validateCredential(null), Reason.INVALID_CREDENTIAL);
  }

  @Test
  void missingFields_areBadRequests() {
    assertThatThrownBy(() -> manager.requestChallenge(" "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> manager.verifyChallenge(keyPair.publicKeyBase64(), null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  private static void assertReason(ThrowingCallable call, Reason reason) {
    assertThatThrownBy(call)
        .isInstanceOf(AuthenticationException.class)
        .satisfies(e -> assertThat(((AuthenticationException) e).reason()).isEqualTo(reason));
  }
}
