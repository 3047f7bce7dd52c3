package com.codeheadsystems.veil.server.exception;

/**
 * The record store rejected a write or could not complete a transaction. A transaction in
 * progress is rolled back.
 */
public class StorageException extends RuntimeException {

  public StorageException(String message) {
    super(message);
  }

  public StorageException(String message, Throwable cause) {
    super(message, cause);
  }
}
