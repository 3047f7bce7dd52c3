package com.codeheadsystems.veil.crypto;

/**
 * A freshly generated Ed25519 key pair, both halves as standard base64 of the raw 32-byte values.
 * <p>
 * The private half is the 32-byte seed. It is handed to the caller once and never stored.
 *
 * @param privateKeyBase64 base64-encoded private seed
 * @param publicKeyBase64  base64-encoded public key
 */
public record Ed25519KeyPair(String privateKeyBase64, String publicKeyBase64) {

  @Override
  public String toString() {
    return "Ed25519KeyPair[publicKeyBase64=" + publicKeyBase64 + "]";
  }
}
