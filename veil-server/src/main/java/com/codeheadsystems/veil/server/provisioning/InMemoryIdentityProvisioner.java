package com.codeheadsystems.veil.server.provisioning;

import com.codeheadsystems.veil.crypto.RandomProvider;
import com.codeheadsystems.veil.server.exception.ProvisioningException;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link IdentityProvisioner} that keeps identities in memory instead of on a homeserver.
 * Suitable for development and testing only.
 */
public class InMemoryIdentityProvisioner implements IdentityProvisioner {

  private static final Logger log = LoggerFactory.getLogger(InMemoryIdentityProvisioner.class);

  private final ConcurrentHashMap<String, Entry> identities = new ConcurrentHashMap<>();
  private final RandomProvider randomProvider;
  private final String serverName;

  public InMemoryIdentityProvisioner(RandomProvider randomProvider, String serverName) {
    this.randomProvider = randomProvider;
    this.serverName = serverName;
    log.warn("Using in-memory identity provisioner for {}: no homeserver is contacted", serverName);
  }

  @Override
  public ProvisionedIdentity createIdentity(byte[] seed, String displayName) {
    String identityId = IdentityNames.identityId(seed, serverName);
    String secret = randomProvider.randomUrlSafeString(32);
    if (identities.putIfAbsent(identityId, new Entry(secret, displayName, false)) != null) {
      throw new ProvisioningException("Identity already exists: " + identityId);
    }
    log.debug("Created identity {}", identityId);
    return new ProvisionedIdentity(identityId, secret);
  }

  @Override
  public boolean deleteIdentity(String identityId) {
    Entry entry = identities.computeIfPresent(identityId, (k, v) -> v.deactivate());
    return entry != null;
  }

  @Override
  public Optional<IdentityStatus> getIdentityStatus(String identityId) {
    return Optional.ofNullable(identities.get(identityId))
        .map(e -> new IdentityStatus(identityId, e.deactivated()));
  }

  @Override
  public Optional<String> authenticate(String identityId, String secret) {
    Entry entry = identities.get(identityId);
    if (entry == null || entry.deactivated() || !entry.secret().equals(secret)) {
      return Optional.empty();
    }
    return Optional.of(randomProvider.randomUrlSafeString(32));
  }

  @Override
  public String serverName() {
    return serverName;
  }

  private record Entry(String secret, String displayName, boolean deactivated) {

    Entry deactivate() {
      return new Entry(secret, displayName, true);
    }
  }
}
