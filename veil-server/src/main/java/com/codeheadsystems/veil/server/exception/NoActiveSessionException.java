package com.codeheadsystems.veil.server.exception;

/**
 * The caller has no active session matching the request.
 */
public class NoActiveSessionException extends RuntimeException {

  public NoActiveSessionException(String message) {
    super(message);
  }
}
