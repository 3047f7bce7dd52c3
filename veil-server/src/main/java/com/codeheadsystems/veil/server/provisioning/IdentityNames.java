package com.codeheadsystems.veil.server.provisioning;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Derives the local part of a temporary identity from a seed:
 * {@code temp_} followed by the first 16 hex characters of SHA-256(seed).
 */
public final class IdentityNames {

  /**
   * Prefix of every temporary identity name.
   */
  public static final String PREFIX = "temp_";

  private static final int HEX_CHARS = 16;

  private IdentityNames() {
  }

  /**
   * @param seed the seed bytes
   * @return the local part, e.g. {@code temp_0a1b2c3d4e5f6a7b}
   */
  public static String localPart(byte[] seed) {
    try {
      byte[] digest = MessageDigest.getInstance("SHA-256").digest(seed);
      return PREFIX + HexFormat.of().formatHex(digest).substring(0, HEX_CHARS);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /**
   * @param seed       the seed bytes
   * @param serverName the homeserver name
   * @return the full identity id, e.g. {@code @temp_0a1b2c3d4e5f6a7b:veil.local}
   */
  public static String identityId(byte[] seed, String serverName) {
    return "@" + localPart(seed) + ":" + serverName;
  }
}
