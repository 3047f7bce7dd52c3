package com.codeheadsystems.veil.server.provisioning;

import com.codeheadsystems.veil.server.exception.ProvisioningException;
import java.util.Optional;

/**
 * Admin surface of the external messaging homeserver: creates, deletes, inspects and logs in
 * temporary identities.
 * <p>
 * Every call is a remote side effect that cannot be rolled back with a local transaction.
 * Callers must not hold a store transaction open across these calls.
 */
public interface IdentityProvisioner {

  /**
   * Provisions a new identity. Each call creates a distinct identity.
   *
   * @param seed        bytes the identity name is derived from
   * @param displayName display name to set on the identity
   * @return the identity and its secret
   * @throws ProvisioningException if the identity could not be created, including timeouts
   */
  ProvisionedIdentity createIdentity(byte[] seed, String displayName);

  /**
   * Deactivates and erases an identity. Safe to retry.
   *
   * @param identityId the identity id
   * @return true if the homeserver confirmed the deletion
   */
  boolean deleteIdentity(String identityId);

  /**
   * @param identityId the identity id
   * @return the status, or empty if the identity does not exist
   * @throws ProvisioningException if the homeserver could not be queried
   */
  Optional<IdentityStatus> getIdentityStatus(String identityId);

  /**
   * Exchanges identity and secret for a bearer credential on the homeserver.
   *
   * @param identityId the identity id
   * @param secret     the identity secret
   * @return the credential, or empty if login failed
   */
  Optional<String> authenticate(String identityId, String secret);

  /**
   * @return the server name identities live on
   */
  String serverName();

  /**
   * @return true if the homeserver answers
   */
  default boolean isReachable() {
    return true;
  }
}
