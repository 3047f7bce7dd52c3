package com.codeheadsystems.veil.synapse;

import com.codeheadsystems.veil.server.exception.ProvisioningException;

/**
 * A Synapse call failed at the transport level or returned an unexpected status.
 */
public class SynapseAccessorException extends ProvisioningException {

  private final int statusCode;

  public SynapseAccessorException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public SynapseAccessorException(final String message, final int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * @return the HTTP status, or -1 if no response was received
   */
  public int statusCode() {
    return statusCode;
  }
}
