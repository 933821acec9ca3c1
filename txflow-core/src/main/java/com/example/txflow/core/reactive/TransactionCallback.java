package com.example.txflow.core.reactive;

import com.example.txflow.core.TransactionException;

/**
 * Single terminal callback of a callback-style transaction run. Invoked exactly once, with either
 * a result or an error.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface TransactionCallback<T> {
  /**
   * Receives the outcome.
   *
   * @param result the work's result on success, {@code null} on failure or when there is none
   * @param error {@code null} on success
   */
  void onComplete(T result, TransactionException error);
}
