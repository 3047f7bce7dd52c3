package com.codeheadsystems.veil.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.veil.server.provisioning.IdentityProvisioner;

/**
 * Checks that the homeserver identities are provisioned on answers.
 */
public class IdentityProvisionerHealthCheck extends HealthCheck {

  private final IdentityProvisioner provisioner;

  public IdentityProvisionerHealthCheck(IdentityProvisioner provisioner) {
    this.provisioner = provisioner;
  }

  @Override
  protected Result check() {
    if (!provisioner.isReachable()) {
      return Result.unhealthy("Homeserver %s is not reachable", provisioner.serverName());
    }
    return Result.healthy("server=%s", provisioner.serverName());
  }
}
