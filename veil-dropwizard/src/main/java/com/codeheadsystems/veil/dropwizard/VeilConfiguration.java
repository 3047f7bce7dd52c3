package com.codeheadsystems.veil.dropwizard;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.dropwizard.core.Configuration;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

/**
 * Dropwizard configuration for the Veil server.
 * <p>
 * For production, set {@code jwtSecretHex} (a hex-encoded secret of at least 32 bytes) so that
 * credentials survive restarts, an {@code adminToken} to enable key administration, and a
 * {@code synapse.baseUrl} so identities are created on a real homeserver. Leaving any of them
 * empty is a dev/test setup.
 * <p>
 * Generate secrets with: {@code openssl rand -hex 32}
 */
public class VeilConfiguration extends Configuration {

  /**
   * Hex-encoded HMAC-SHA256 signing secret for credentials.
   * Leave empty for random generation (dev only, credentials become invalid on restart).
   */
  private String jwtSecretHex = "";

  /**
   * Credential issuer claim.
   */
  @NotEmpty
  private String jwtIssuer = "veil";

  /**
   * Credential lifetime in seconds.
   */
  @Min(1)
  private long jwtTtlSeconds = 86400;

  /**
   * How long a challenge may be answered, in seconds.
   */
  @Min(1)
  private long challengeTtlSeconds = 300;

  /**
   * Upper bound on outstanding challenges. New challenges are refused with 503 beyond it.
   */
  @Min(1)
  private int maxPendingChallenges = 10_000;

  /**
   * Lifetime of a generated key in seconds.
   */
  @Min(1)
  private long keyTtlSeconds = 604800;

  /**
   * Idle time after which the inactive-session sweep ends a session.
   */
  @Min(1)
  private long sessionTimeoutMinutes = 60;

  @Min(1)
  private long expiredKeySweepMinutes = 60;

  @Min(1)
  private long inactiveSessionSweepMinutes = 30;

  @Min(1)
  private long orphanSweepMinutes = 1440;

  @Min(1)
  private long challengeSweepSeconds = 60;

  /**
   * Shared secret expected in the {@code X-Admin-Token} header of key and cleanup endpoints.
   * Leave empty to disable those endpoints.
   */
  private String adminToken = "";

  /**
   * Homeserver the temporary identities are provisioned on.
   */
  @Valid
  @NotNull
  private SynapseConfiguration synapse = new SynapseConfiguration();

  /**
   * Gets jwt secret hex.
   *
   * @return the jwt secret hex
   */
  @JsonProperty
  public String getJwtSecretHex() {
    return jwtSecretHex;
  }

  /**
   * Sets jwt secret hex.
   *
   * @param jwtSecretHex the jwt secret hex
   */
  @JsonProperty
  public void setJwtSecretHex(String jwtSecretHex) {
    this.jwtSecretHex = jwtSecretHex;
  }

  /**
   * Gets jwt issuer.
   *
   * @return the jwt issuer
   */
  @JsonProperty
  public String getJwtIssuer() {
    return jwtIssuer;
  }

  /**
   * Sets jwt issuer.
   *
   * @param jwtIssuer the jwt issuer
   */
  @JsonProperty
  public void setJwtIssuer(String jwtIssuer) {
    this.jwtIssuer = jwtIssuer;
  }

  /**
   * Gets jwt ttl seconds.
   *
   * @return the jwt ttl seconds
   */
  @JsonProperty
  public long getJwtTtlSeconds() {
    return jwtTtlSeconds;
  }

  /**
   * Sets jwt ttl seconds.
   *
   * @param jwtTtlSeconds the jwt ttl seconds
   */
  @JsonProperty
  public void setJwtTtlSeconds(long jwtTtlSeconds) {
    this.jwtTtlSeconds = jwtTtlSeconds;
  }

  /**
   * Gets challenge ttl seconds.
   *
   * @return the challenge ttl seconds
   */
  @JsonProperty
  public long getChallengeTtlSeconds() {
    return challengeTtlSeconds;
  }

  /**
   * Sets challenge ttl seconds.
   *
   * @param challengeTtlSeconds the challenge ttl seconds
   */
  @JsonProperty
  public void setChallengeTtlSeconds(long challengeTtlSeconds) {
    this.challengeTtlSeconds = challengeTtlSeconds;
  }

  /**
   * Gets max pending challenges.
   *
   * @return the max pending challenges
   */
  @JsonProperty
  public int getMaxPendingChallenges() {
    return maxPendingChallenges;
  }

  /**
   * Sets max pending challenges.
   *
   * @param maxPendingChallenges the max pending challenges
   */
  @JsonProperty
  public void setMaxPendingChallenges(int maxPendingChallenges) {
    this.maxPendingChallenges = maxPendingChallenges;
  }

  /**
   * Gets key ttl seconds.
   *
   * @return the key ttl seconds
   */
  @JsonProperty
  public long getKeyTtlSeconds() {
    return keyTtlSeconds;
  }

  /**
   * Sets key ttl seconds.
   *
   * @param keyTtlSeconds the key ttl seconds
   */
  @JsonProperty
  public void setKeyTtlSeconds(long keyTtlSeconds) {
    this.keyTtlSeconds = keyTtlSeconds;
  }

  /**
   * Gets session timeout minutes.
   *
   * @return the session timeout minutes
   */
  @JsonProperty
  public long getSessionTimeoutMinutes() {
    return sessionTimeoutMinutes;
  }

  /**
   * Sets session timeout minutes.
   *
   * @param sessionTimeoutMinutes the session timeout minutes
   */
  @JsonProperty
  public void setSessionTimeoutMinutes(long sessionTimeoutMinutes) {
    this.sessionTimeoutMinutes = sessionTimeoutMinutes;
  }

  /**
   * Gets expired key sweep minutes.
   *
   * @return the expired key sweep minutes
   */
  @JsonProperty
  public long getExpiredKeySweepMinutes() {
    return expiredKeySweepMinutes;
  }

  /**
   * Sets expired key sweep minutes.
   *
   * @param expiredKeySweepMinutes the expired key sweep minutes
   */
  @JsonProperty
  public void setExpiredKeySweepMinutes(long expiredKeySweepMinutes) {
    this.expiredKeySweepMinutes = expiredKeySweepMinutes;
  }

  /**
   * Gets inactive session sweep minutes.
   *
   * @return the inactive session sweep minutes
   */
  @JsonProperty
  public long getInactiveSessionSweepMinutes() {
    return inactiveSessionSweepMinutes;
  }

  /**
   * Sets inactive session sweep minutes.
   *
   * @param inactiveSessionSweepMinutes the inactive session sweep minutes
   */
  @JsonProperty
  public void setInactiveSessionSweepMinutes(long inactiveSessionSweepMinutes) {
    this.inactiveSessionSweepMinutes = inactiveSessionSweepMinutes;
  }

  /**
   * Gets orphan sweep minutes.
   *
   * @return the orphan sweep minutes
   */
  @JsonProperty
  public long getOrphanSweepMinutes() {
    return orphanSweepMinutes;
  }

  /**
   * Sets orphan sweep minutes.
   *
   * @param orphanSweepMinutes the orphan sweep minutes
   */
  @JsonProperty
  public void setOrphanSweepMinutes(long orphanSweepMinutes) {
    this.orphanSweepMinutes = orphanSweepMinutes;
  }

  /**
   * Gets challenge sweep seconds.
   *
   * @return the challenge sweep seconds
   */
  @JsonProperty
  public long getChallengeSweepSeconds() {
    return challengeSweepSeconds;
  }

  /**
   * Sets challenge sweep seconds.
   *
   * @param challengeSweepSeconds the challenge sweep seconds
   */
  @JsonProperty
  public void setChallengeSweepSeconds(long challengeSweepSeconds) {
    this.challengeSweepSeconds = challengeSweepSeconds;
  }

  /**
   * Gets admin token.
   *
   * @return the admin token
   */
  @JsonProperty
  public String getAdminToken() {
    return adminToken;
  }

  /**
   * Sets admin token.
   *
   * @param adminToken the admin token
   */
  @JsonProperty
  public void setAdminToken(String adminToken) {
    this.adminToken = adminToken;
  }

  /**
   * Gets synapse.
   *
   * @return the synapse
   */
  @JsonProperty
  public SynapseConfiguration getSynapse() {
    return synapse;
  }

  /**
   * Sets synapse.
   *
   * @param synapse the synapse
   */
  @JsonProperty
  public void setSynapse(SynapseConfiguration synapse) {
    this.synapse = synapse;
  }
}
