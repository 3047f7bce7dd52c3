package com.codeheadsystems.veil.server.manager;

import com.codeheadsystems.veil.crypto.Ed25519Crypto;
import com.codeheadsystems.veil.crypto.Ed25519KeyPair;
import com.codeheadsystems.veil.server.cache.ChallengeCache;
import com.codeheadsystems.veil.server.exception.UnknownKeyException;
import com.codeheadsystems.veil.server.model.AuthorizedKey;
import com.codeheadsystems.veil.server.store.RecordStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Administrative lifecycle of authorized keys.
 * <p>
 * Only public halves are stored. A generated private key leaves the server once, in the return
 * value of {@link #generateKeys(int)}.
 */
public class KeyManager {

  /**
   * Largest batch {@link #generateKeys(int)} accepts.
   */
  public static final int MAX_BATCH = 100;

  private static final Logger log = LoggerFactory.getLogger(KeyManager.class);

  private final Ed25519Crypto crypto;
  private final RecordStore store;
  private final ChallengeCache challengeCache;
  private final Duration keyTtl;
  private final Clock clock;

  public KeyManager(Ed25519Crypto crypto,
                    RecordStore store,
                    ChallengeCache challengeCache,
                    Duration keyTtl,
                    Clock clock) {
    this.crypto = crypto;
    this.store = store;
    this.challengeCache = challengeCache;
    this.keyTtl = keyTtl;
    this.clock = clock;
  }

  /**
   * A generated key with its private half.
   *
   * @param key              the stored record
   * @param privateKeyBase64 the private seed, not stored
   */
  public record IssuedKey(AuthorizedKey key, String privateKeyBase64) {

    @Override
    public String toString() {
      return "IssuedKey[key=" + key + "]";
    }
  }

  /**
   * Generates and authorizes key pairs. All of them are stored in one transaction.
   *
   * @param count how many, 1 to {@link #MAX_BATCH}
   * @return the keys with their private halves
   * @throws IllegalArgumentException if count is out of range
   */
  public List<IssuedKey> generateKeys(int count) {
    if (count < 1 || count > MAX_BATCH) {
      throw new IllegalArgumentException("count must be between 1 and " + MAX_BATCH);
    }
    Instant now = clock.instant();
    List<IssuedKey> issued = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      Ed25519KeyPair pair = crypto.generateKeyPair();
      issued.add(new IssuedKey(
          AuthorizedKey.create(pair.publicKeyBase64(), now, now.plus(keyTtl)),
          pair.privateKeyBase64()));
    }
    store.runInTransaction(() -> issued.forEach(k -> store.storeKey(k.key())));
    log.info("Authorized {} new key(s) expiring {}", count, now.plus(keyTtl));
    return issued;
  }

  /**
   * @return every stored key, oldest first
   */
  public List<AuthorizedKey> listKeys() {
    return store.listKeys();
  }

  /**
   * Revokes a key and discards its outstanding challenge. Revoking twice is a no-op.
   *
   * @param publicKeyBase64 the key
   * @throws IllegalArgumentException if the key is missing
   * @throws UnknownKeyException      if the key is not stored
   */
  public void revokeKey(String publicKeyBase64) {
    AuthenticationManager.requireField(publicKeyBase64, "public_key");
    store.runInTransaction(() -> {
      AuthorizedKey key = store.loadKey(publicKeyBase64)
          .orElseThrow(() -> new UnknownKeyException("Unknown key"));
      if (key.active()) {
        store.storeKey(key.revoked());
      }
    });
    challengeCache.remove(publicKeyBase64);
    log.info("Revoked key");
  }
}
