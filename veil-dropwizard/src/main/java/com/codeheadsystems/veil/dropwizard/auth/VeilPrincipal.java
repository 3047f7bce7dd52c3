package com.codeheadsystems.veil.dropwizard.auth;

import java.security.Principal;

/**
 * Principal representing an authenticated key holder.
 *
 * @param publicKeyBase64 the authorized public key from the credential subject
 */
public record VeilPrincipal(String publicKeyBase64) implements Principal {

  @Override
  public String getName() {
    return publicKeyBase64;
  }
}
