package com.codeheadsystems.veil.crypto;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Encapsulates a {@link SecureRandom} instance for injectable random byte generation.
 * Used by {@link Ed25519Crypto} for key and challenge generation, and by the session layer
 * for identity secrets and alias salts.
 */
public record RandomProvider(SecureRandom random) {

  /**
   * Creates a RandomProvider with a default {@link SecureRandom}.
   */
  public RandomProvider() {
    this(new SecureRandom());
  }

  /**
   * Generates a random byte array of the given length.
   *
   * @param len the number of random bytes to generate
   * @return a new byte array filled with random bytes
   */
  public byte[] randomBytes(int len) {
    byte[] out = new byte[len];
    random.nextBytes(out);
    return out;
  }

  /**
   * Generates {@code len} random bytes and returns them URL-safe base64 encoded without padding.
   *
   * @param len the number of random bytes to generate
   * @return the encoded value
   */
  public String randomUrlSafeString(int len) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(randomBytes(len));
  }
}
