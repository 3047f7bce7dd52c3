package com.codeheadsystems.veil.server.provisioning;

/**
 * An identity created on the homeserver.
 *
 * @param identityId the addressable identity id
 * @param secret     the password for the identity, never persisted locally
 */
public record ProvisionedIdentity(String identityId, String secret) {

  @Override
  public String toString() {
    return "ProvisionedIdentity[identityId=" + identityId + "]";
  }
}
