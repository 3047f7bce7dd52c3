package com.codeheadsystems.veil.server.store;

import java.util.function.Supplier;

/**
 * The persisted record store: keys and sessions with transactional commit and rollback.
 */
public interface RecordStore extends AuthorizedKeyStore, ChatSessionStore {

  /**
   * Runs {@code work} as one transaction. If it throws, every mutation it made is rolled back
   * and the exception propagates. Transactions nest by joining the outer one.
   *
   * @param work the work
   * @param <T>  result type
   * @return the result of {@code work}
   * @throws com.codeheadsystems.veil.server.exception.StorageException if the store rejects a
   *     write or fails to commit
   */
  <T> T inTransaction(Supplier<T> work);

  /**
   * Void form of {@link #inTransaction(Supplier)}.
   *
   * @param work the work
   */
  default void runInTransaction(Runnable work) {
    inTransaction(() -> {
      work.run();
      return null;
    });
  }
}
