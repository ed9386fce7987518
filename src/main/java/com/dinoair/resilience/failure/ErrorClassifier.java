package com.dinoair.resilience.failure;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

@FunctionalInterface
public interface ErrorClassifier {

  ErrorCategory classify(Throwable error);

  /**
   * Strips the {@link CompletionException} / {@link ExecutionException} wrappers that future
   * composition adds around the real cause.
   */
  static Throwable unwrap(Throwable error) {
    Throwable t = error;
    while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null)
      t = t.getCause();
    return t;
  }
}
