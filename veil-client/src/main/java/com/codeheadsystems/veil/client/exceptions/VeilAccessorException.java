package com.codeheadsystems.veil.client.exceptions;

/**
 * A call to the Veil server failed: transport error, interruption or an error status other
 * than 401.
 */
public class VeilAccessorException extends RuntimeException {

  private final int statusCode;

  public VeilAccessorException(final String message, final Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public VeilAccessorException(final String message, final int statusCode) {
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
