package com.codeheadsystems.veil.dropwizard;

import com.codeheadsystems.veil.crypto.Ed25519Crypto;
import com.codeheadsystems.veil.crypto.RandomProvider;
import com.codeheadsystems.veil.dropwizard.auth.VeilAuthenticator;
import com.codeheadsystems.veil.dropwizard.auth.VeilPrincipal;
import com.codeheadsystems.veil.dropwizard.health.ChallengeCacheHealthCheck;
import com.codeheadsystems.veil.dropwizard.health.IdentityProvisionerHealthCheck;
import com.codeheadsystems.veil.dropwizard.lifecycle.CleanupSchedulerManager;
import com.codeheadsystems.veil.server.alias.AliasGenerator;
import com.codeheadsystems.veil.server.auth.CredentialManager;
import com.codeheadsystems.veil.server.cache.ChallengeCache;
import com.codeheadsystems.veil.server.cache.InMemoryChallengeCache;
import com.codeheadsystems.veil.server.manager.AuthenticationManager;
import com.codeheadsystems.veil.server.manager.CleanupManager;
import com.codeheadsystems.veil.server.manager.KeyManager;
import com.codeheadsystems.veil.server.manager.SessionManager;
import com.codeheadsystems.veil.server.provisioning.IdentityProvisioner;
import com.codeheadsystems.veil.server.provisioning.InMemoryIdentityProvisioner;
import com.codeheadsystems.veil.server.resource.AdminResource;
import com.codeheadsystems.veil.server.resource.AdminTokenGuard;
import com.codeheadsystems.veil.server.resource.AuthResource;
import com.codeheadsystems.veil.server.resource.KeyResource;
import com.codeheadsystems.veil.server.resource.SessionResource;
import com.codeheadsystems.veil.server.resource.UserResource;
import com.codeheadsystems.veil.server.scheduler.CleanupSchedule;
import com.codeheadsystems.veil.server.scheduler.CleanupScheduler;
import com.codeheadsystems.veil.server.store.InMemoryRecordStore;
import com.codeheadsystems.veil.server.store.RecordStore;
import com.codeheadsystems.veil.synapse.SynapseIdentityProvisioner;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the Veil server into an existing Dropwizard application.
 * <p>
 * Registers the auth, session, user, key and admin resources, the health checks, a bearer
 * credential auth filter for the application's own {@code @Auth VeilPrincipal} routes, and the
 * managed cleanup scheduler. Requires a {@link VeilConfiguration} block in the application's YAML.
 * <p>
 * Embed in your application with an in-memory store (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new VeilBundle<>());
 * }</pre>
 * <p>
 * Or supply a persistent store:
 * <pre>{@code
 *   bootstrap.addBundle(new VeilBundle<>(myRecordStore));
 * }</pre>
 * The identity provisioner talks to Synapse when {@code synapse.baseUrl} is set and is in-memory
 * otherwise, unless one is passed to the constructor.
 */
@Singleton
public class VeilBundle<C extends VeilConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(VeilBundle.class);

  private final RecordStore store;
  private final IdentityProvisioner provisioner;
  private final Clock clock;

  /**
   * Creates a bundle backed by an in-memory record store.
   * <p>
   * For dev/test only: all keys and sessions are lost on restart.
   */
  public VeilBundle() {
    this(new InMemoryRecordStore(), null, Clock.systemUTC());
    log.warn("""
        #################################################################
        # WARNING: Using an in-memory record store. All authorized keys #
        # and sessions will be lost on restart.                         #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied store.
   *
   * @param store the record store
   */
  @Inject
  public VeilBundle(RecordStore store) {
    this(store, null, Clock.systemUTC());
  }

  /**
   * Creates a bundle with every collaborator supplied.
   *
   * @param store       the record store
   * @param provisioner the identity provisioner, or null to build one from the configuration
   * @param clock       the clock all expiry decisions are made against
   */
  public VeilBundle(RecordStore store, IdentityProvisioner provisioner, Clock clock) {
    this.store = store;
    this.provisioner = provisioner;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    RandomProvider randomProvider = new RandomProvider();
    Ed25519Crypto crypto = new Ed25519Crypto(randomProvider);
    ChallengeCache challengeCache = new InMemoryChallengeCache(clock, configuration.getMaxPendingChallenges());
    CredentialManager credentialManager = buildCredentialManager(configuration);
    IdentityProvisioner identityProvisioner = buildProvisioner(configuration, environment, randomProvider);

    AuthenticationManager authenticationManager = new AuthenticationManager(crypto, challengeCache, store,
        credentialManager, Duration.ofSeconds(configuration.getChallengeTtlSeconds()), clock);
    KeyManager keyManager = new KeyManager(crypto, store, challengeCache,
        Duration.ofSeconds(configuration.getKeyTtlSeconds()), clock);
    SessionManager sessionManager = new SessionManager(store, identityProvisioner, new AliasGenerator(),
        randomProvider, clock);
    CleanupManager cleanupManager = new CleanupManager(store, identityProvisioner, challengeCache,
        Duration.ofMinutes(configuration.getSessionTimeoutMinutes()), clock);
    AdminTokenGuard adminTokenGuard = new AdminTokenGuard(configuration.getAdminToken());

    environment.jersey().register(new AuthResource(authenticationManager));
    environment.jersey().register(new SessionResource(authenticationManager, sessionManager));
    environment.jersey().register(new UserResource(authenticationManager, sessionManager));
    environment.jersey().register(new KeyResource(keyManager, adminTokenGuard));
    environment.jersey().register(new AdminResource(cleanupManager, adminTokenGuard));

    environment.healthChecks().register("challenge-cache", new ChallengeCacheHealthCheck(challengeCache));
    environment.healthChecks().register("identity-provisioner",
        new IdentityProvisionerHealthCheck(identityProvisioner));

    // Credential auth filter for the application's own routes
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<VeilPrincipal>()
            .setAuthenticator(new VeilAuthenticator(authenticationManager))
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(VeilPrincipal.class));

    environment.lifecycle().manage(new CleanupSchedulerManager(
        new CleanupScheduler(cleanupManager, buildSchedule(configuration))));
  }

  private CredentialManager buildCredentialManager(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating randomly. "
          + "Credentials will be invalidated on restart. Do not use in production.");
      secret = new RandomProvider().randomBytes(CredentialManager.MIN_SECRET_LENGTH);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
    }
    return new CredentialManager(secret, configuration.getJwtIssuer(),
        Duration.ofSeconds(configuration.getJwtTtlSeconds()), clock);
  }

  private IdentityProvisioner buildProvisioner(C configuration, Environment environment,
                                               RandomProvider randomProvider) {
    if (provisioner != null) {
      return provisioner;
    }
    SynapseConfiguration synapse = configuration.getSynapse();
    if (!synapse.isEnabled()) {
      log.warn("No synapse.baseUrl configured, identities are kept in memory. Do not use in production.");
      return new InMemoryIdentityProvisioner(randomProvider, synapse.getServerName());
    }
    return SynapseIdentityProvisioner.create(synapse.toSynapseConfig(), environment.getObjectMapper());
  }

  private static CleanupSchedule buildSchedule(VeilConfiguration configuration) {
    return new CleanupSchedule(
        Duration.ofMinutes(configuration.getExpiredKeySweepMinutes()),
        Duration.ofMinutes(configuration.getInactiveSessionSweepMinutes()),
        Duration.ofMinutes(configuration.getOrphanSweepMinutes()),
        Duration.ofSeconds(configuration.getChallengeSweepSeconds()));
  }
}
