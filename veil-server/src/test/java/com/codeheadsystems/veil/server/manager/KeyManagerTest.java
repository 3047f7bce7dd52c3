package com.codeheadsystems.veil.server.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.veil.crypto.Ed25519Crypto;
import com.codeheadsystems.veil.server.MutableClock;
import com.codeheadsystems.veil.server.cache.InMemoryChallengeCache;
import com.codeheadsystems.veil.server.exception.UnknownKeyException;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import com.codeheadsystems.veil.server.store.InMemoryRecordStore;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class KeyManagerTest {

  private static final Duration KEY_TTL = Duration.ofDays(7);

  private final Ed25519Crypto crypto = new Ed25519Crypto();
  private MutableClock clock;
  private InMemoryRecordStore store;
  private InMemoryChallengeCache cache;
  private KeyManager keyManager;

  @BeforeEach
  void setUp() {
    clock = MutableClock.atDefaultStart();
    store = new InMemoryRecordStore();
    cache = new InMemoryChallengeCache(clock);
    keyManager = new KeyManager(crypto, store, cache, KEY_TTL, clock);
  }

  @Test
  void generateKeys_storesOnlyPublicHalves() {
    List<KeyManager.IssuedKey> issued = keyManager.generateKeys(3);

    assertThat(issued).hasSize(3);
    for (KeyManager.IssuedKey key : issued) {
      assertThat(crypto.derivePublicKey(key.privateKeyBase64())).isEqualTo(key.key().publicKeyBase64());
      AuthorizedKey stored = store.loadKey(key.key().publicKeyBase64()).orElseThrow();
      assertThat(stored.active()).isTrue();
      assertThat(stored.expiresAt()).isEqualTo(clock.instant().plus(KEY_TTL));
      assertThat(stored.lastUsedAt()).isNull();
      assertThat(key.toString()).doesNotContain(key.privateKeyBase64());
    }
    assertThat(keyManager.listKeys()).hasSize(3);
  }

  @Test
  void generateKeys_rejectsOutOfRangeCounts() {
    assertThatThrownBy(() -> keyManager.generateKeys(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> keyManager.generateKeys(KeyManager.MAX_BATCH + 1))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(keyManager.generateKeys(KeyManager.MAX_BATCH)).hasSize(KeyManager.MAX_BATCH);
  }

  @Test
  void revokeKey_deactivatesAndDropsChallenge() {
    String publicKey = keyManager.generateKeys(1).get(0).key().publicKeyBase64();
    cache.put(publicKey, "nonce", Duration.ofMinutes(5));

    keyManager.revokeKey(publicKey);
    keyManager.revokeKey(publicKey);

    assertThat(store.loadKey(publicKey).orElseThrow().active()).isFalse();
    assertThat(cache.take(publicKey)).isEmpty();
  }

  @Test
  void revokeKey_unknownKey_throws() {
    assertThatThrownBy(() -> keyManager.revokeKey("unknown")).isInstanceOf(UnknownKeyException.class);
    assertThatThrownBy(() -> keyManager.revokeKey(null)).isInstanceOf(IllegalArgumentException.class);
  }
}
