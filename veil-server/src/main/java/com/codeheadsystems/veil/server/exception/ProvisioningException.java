package com.codeheadsystems.veil.server.exception;

/**
 * The identity provisioner could not create an identity. No local state was written.
 */
public class ProvisioningException extends RuntimeException {

  public ProvisioningException(String message) {
    super(message);
  }

  public ProvisioningException(String message, Throwable cause) {
    super(message, cause);
  }
}
