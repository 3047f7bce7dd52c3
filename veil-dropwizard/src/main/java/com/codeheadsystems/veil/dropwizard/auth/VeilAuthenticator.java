package com.codeheadsystems.veil.dropwizard.auth;

import com.codeheadsystems.veil.server.manager.AuthenticationManager;
import io.dropwizard.auth.Authenticator;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard {@link Authenticator} that accepts a Veil credential only while its key is still
 * usable.
 */
public class VeilAuthenticator implements Authenticator<String, VeilPrincipal> {

  private static final Logger log = LoggerFactory.getLogger(VeilAuthenticator.class);

  private final AuthenticationManager authenticationManager;

  public VeilAuthenticator(AuthenticationManager authenticationManager) {
    this.authenticationManager = authenticationManager;
  }

  @Override
  public Optional<VeilPrincipal> authenticate(String token) {
    try {
      return Optional.of(new VeilPrincipal(authenticationManager.validateCredential(token)));
    } catch (SecurityException e) {
      log.debug("Credential rejected: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
