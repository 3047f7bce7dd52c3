package com.codeheadsystems.veil.server.auth;

import com.auth0.jwt.JWT;
import com.auth0.jwt.JWTVerifier;
import com.auth0.jwt.algorithms.Algorithm;
import com.auth0.jwt.exceptions.JWTVerificationException;
import com.auth0.jwt.interfaces.DecodedJWT;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and verifies the bearer credentials handed out after a successful challenge.
 * <p>
 * Tokens are HMAC-SHA256 JWTs carrying {@code iss}, {@code sub} (the public key), {@code iat},
 * {@code exp} and a random {@code jti}. There is no server-side token state: a token is valid
 * until it expires or the secret changes.
 */
public class CredentialManager {

  /**
   * Minimum secret length in bytes for HMAC-SHA256.
   */
  public static final int MIN_SECRET_LENGTH = 32;

  private static final Logger log = LoggerFactory.getLogger(CredentialManager.class);

  private final Algorithm algorithm;
  private final JWTVerifier verifier;
  private final String issuer;
  private final Duration ttl;
  private final Clock clock;

  /**
   * Creates a new CredentialManager.
   *
   * @param secret HMAC-SHA256 signing secret, at least {@link #MIN_SECRET_LENGTH} bytes
   * @param issuer JWT issuer claim
   * @param ttl    token lifetime
   * @param clock  time source for issuance and expiry checks
   */
  public CredentialManager(byte[] secret, String issuer, Duration ttl, Clock clock) {
    if (secret == null || secret.length < MIN_SECRET_LENGTH) {
      throw new IllegalArgumentException("JWT secret must be at least " + MIN_SECRET_LENGTH + " bytes");
    }
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("JWT ttl must be positive");
    }
    this.algorithm = Algorithm.HMAC256(secret);
    this.verifier = ((JWTVerifier.BaseVerification) JWT.require(algorithm).withIssuer(issuer)).build(clock);
    this.issuer = issuer;
    this.ttl = ttl;
    this.clock = clock;
  }

  /**
   * Issues a credential for a subject.
   *
   * @param subject the authenticated public key
   * @return the signed credential
   */
  public IssuedCredential issue(String subject) {
    Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
    Instant expiresAt = now.plus(ttl);
    String jti = UUID.randomUUID().toString();

    String token = JWT.create()
        .withIssuer(issuer)
        .withJWTId(jti)
        .withSubject(subject)
        .withIssuedAt(now)
        .withExpiresAt(expiresAt)
        .sign(algorithm);

    log.debug("Issued credential jti={} expiring {}", jti, expiresAt);
    return new IssuedCredential(token, now, expiresAt);
  }

  /**
   * Verifies a credential.
   *
   * @param token compact JWT, may be null
   * @return the subject if signature, issuer and expiry check out, empty otherwise
   */
  public Optional<String> validate(String token) {
    if (token == null || token.isBlank()) {
      return Optional.empty();
    }
    try {
      DecodedJWT decoded = verifier.verify(token);
      return Optional.ofNullable(decoded.getSubject());
    } catch (JWTVerificationException e) {
      log.debug("Credential verification failed: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
