package com.codeheadsystems.veil.crypto;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import org.bouncycastle.crypto.params.Ed25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.Ed25519PublicKeyParameters;
import org.bouncycastle.crypto.signers.Ed25519Signer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless Ed25519 primitives used by the challenge-response protocol.
 * <p>
 * Keys travel as standard base64 of their raw encodings: 32 bytes for the public key, 32 bytes
 * for the private seed. Messages are signed as their UTF-8 bytes, so a challenge nonce is signed
 * exactly as the base64 string the server handed out.
 * <p>
 * {@link #verifySignature} never throws. Malformed base64, wrong key or signature lengths, an
 * invalid curve point and a plain mismatch all collapse to {@code false}.
 */
public class Ed25519Crypto {

  /**
   * Raw public key length in bytes.
   */
  public static final int PUBLIC_KEY_LENGTH = Ed25519PublicKeyParameters.KEY_SIZE;

  /**
   * Raw private seed length in bytes.
   */
  public static final int PRIVATE_KEY_LENGTH = Ed25519PrivateKeyParameters.KEY_SIZE;

  /**
   * Raw signature length in bytes.
   */
  public static final int SIGNATURE_LENGTH = Ed25519PrivateKeyParameters.SIGNATURE_SIZE;

  /**
   * Number of random bytes in a challenge nonce. Base64 encodes this to 44 characters.
   */
  public static final int CHALLENGE_LENGTH = 32;

  private static final Logger log = LoggerFactory.getLogger(Ed25519Crypto.class);
  private static final Base64.Encoder B64 = Base64.getEncoder();
  private static final Base64.Decoder B64D = Base64.getDecoder();

  private final RandomProvider randomProvider;

  /**
   * Instantiates a new Ed25519 crypto with a default {@link RandomProvider}.
   */
  public Ed25519Crypto() {
    this(new RandomProvider());
  }

  /**
   * Instantiates a new Ed25519 crypto.
   *
   * @param randomProvider source of randomness for keys and challenges
   */
  public Ed25519Crypto(final RandomProvider randomProvider) {
    this.randomProvider = randomProvider;
  }

  /**
   * Generates a new key pair.
   *
   * @return the key pair
   */
  public Ed25519KeyPair generateKeyPair() {
    Ed25519PrivateKeyParameters privateKey = new Ed25519PrivateKeyParameters(randomProvider.random());
    Ed25519PublicKeyParameters publicKey = privateKey.generatePublicKey();
    return new Ed25519KeyPair(
        B64.encodeToString(privateKey.getEncoded()),
        B64.encodeToString(publicKey.getEncoded()));
  }

  /**
   * Creates a random challenge nonce.
   *
   * @return base64 of {@link #CHALLENGE_LENGTH} random bytes
   */
  public String createChallenge() {
    return B64.encodeToString(randomProvider.randomBytes(CHALLENGE_LENGTH));
  }

  /**
   * Signs the UTF-8 bytes of a message.
   *
   * @param message          the message
   * @param privateKeyBase64 base64-encoded private seed
   * @return base64-encoded signature
   * @throws IllegalArgumentException if the private key is not a base64 32-byte seed
   */
  public String sign(final String message, final String privateKeyBase64) {
    Ed25519PrivateKeyParameters privateKey = privateKey(privateKeyBase64);
    Ed25519Signer signer = new Ed25519Signer();
    signer.init(true, privateKey);
    byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
    signer.update(bytes, 0, bytes.length);
    return B64.encodeToString(signer.generateSignature());
  }

  /**
   * Derives the public key for a private seed.
   *
   * @param privateKeyBase64 base64-encoded private seed
   * @return base64-encoded public key
   * @throws IllegalArgumentException if the private key is not a base64 32-byte seed
   */
  public String derivePublicKey(final String privateKeyBase64) {
    return B64.encodeToString(privateKey(privateKeyBase64).generatePublicKey().getEncoded());
  }

  /**
   * Verifies a signature over the UTF-8 bytes of a message.
   *
   * @param message         the message that was signed
   * @param signatureBase64 base64-encoded signature
   * @param publicKeyBase64 base64-encoded public key
   * @return true only if every input is well formed and the signature matches
   */
  public boolean verifySignature(final String message,
                                 final String signatureBase64,
                                 final String publicKeyBase64) {
    if (message == null || signatureBase64 == null || publicKeyBase64 == null) {
      return false;
    }
    try {
      byte[] publicKeyBytes = B64D.decode(publicKeyBase64);
      byte[] signature = B64D.decode(signatureBase64);
      if (publicKeyBytes.length != PUBLIC_KEY_LENGTH || signature.length != SIGNATURE_LENGTH) {
        return false;
      }
      Ed25519Signer verifier = new Ed25519Signer();
      verifier.init(false, new Ed25519PublicKeyParameters(publicKeyBytes, 0));
      byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
      verifier.update(bytes, 0, bytes.length);
      return verifier.verifySignature(signature);
    } catch (RuntimeException e) {
      log.trace("Signature verification rejected malformed input: {}", e.getClass().getSimpleName());
      return false;
    }
  }

  private static Ed25519PrivateKeyParameters privateKey(final String privateKeyBase64) {
    if (privateKeyBase64 == null || privateKeyBase64.isBlank()) {
      throw new IllegalArgumentException("Missing private key");
    }
    byte[] seed;
    try {
      seed = B64D.decode(privateKeyBase64.trim());
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Invalid base64 in private key", e);
    }
    if (seed.length != PRIVATE_KEY_LENGTH) {
      throw new IllegalArgumentException(
          "Private key must be " + PRIVATE_KEY_LENGTH + " bytes, got " + seed.length);
    }
    return new Ed25519PrivateKeyParameters(seed, 0);
  }
}
