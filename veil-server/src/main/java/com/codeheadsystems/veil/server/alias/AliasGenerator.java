package com.codeheadsystems.veil.server.alias;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Maps seed bytes onto a display alias of the form {@code AdjectiveAnimal0000}.
 * <p>
 * The seed is hashed with SHA-256. Digest bytes 0-1 pick the adjective, bytes 2-3 the animal and
 * bytes 4-5 (mod 10000) the zero-padded suffix, each read as an unsigned big-endian short. The
 * mapping is deterministic; unpredictability comes from the seed.
 */
public class AliasGenerator {

  static final List<String> ADJECTIVES = List.of(
      "Silent", "Swift", "Dark", "Bright", "Hidden", "Quick", "Calm", "Wild",
      "Gentle", "Fierce", "Mystic", "Noble", "Clever", "Bold", "Shy", "Wise",
      "Ancient", "Modern", "Frozen", "Burning", "Crystal", "Shadow", "Golden",
      "Silver", "Cosmic", "Quantum", "Digital", "Phantom", "Stealth", "Ghost");

  static final List<String> ANIMALS = List.of(
      "Fox", "Wolf", "Eagle", "Raven", "Tiger", "Lion", "Bear", "Hawk",
      "Owl", "Falcon", "Panther", "Leopard", "Lynx", "Coyote", "Badger",
      "Otter", "Seal", "Whale", "Shark", "Dolphin", "Phoenix", "Dragon",
      "Cobra", "Viper", "Spider", "Scorpion", "Mantis", "Beetle", "Moth");

  private static final Pattern ALIAS_PATTERN = Pattern.compile("^[A-Za-z]+[0-9]{4}$");
  private static final int MIN_LENGTH = 10;

  /**
   * @param seed the seed bytes
   * @return the alias
   */
  public String generate(byte[] seed) {
    byte[] digest = sha256(seed);
    String adjective = ADJECTIVES.get(unsignedShort(digest, 0) % ADJECTIVES.size());
    String animal = ANIMALS.get(unsignedShort(digest, 2) % ANIMALS.size());
    int number = unsignedShort(digest, 4) % 10_000;
    return adjective + animal + String.format(Locale.ROOT, "%04d", number);
  }

  /**
   * @param alias candidate alias, may be null
   * @return true if the alias is letters followed by exactly four digits, ten characters or more
   */
  public boolean isValid(String alias) {
    return alias != null && alias.length() >= MIN_LENGTH && ALIAS_PATTERN.matcher(alias).matches();
  }

  private static int unsignedShort(byte[] bytes, int offset) {
    return ((bytes[offset] & 0xff) << 8) | (bytes[offset + 1] & 0xff);
  }

  private static byte[] sha256(byte[] input) {
    try {
      return MessageDigest.getInstance("SHA-256").digest(input);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }
}
