package com.codeheadsystems.veil.server.exception;

/**
 * An administrative operation named a public key that is not in the store.
 */
public class UnknownKeyException extends RuntimeException {

  public UnknownKeyException(String message) {
    super(message);
  }
}
