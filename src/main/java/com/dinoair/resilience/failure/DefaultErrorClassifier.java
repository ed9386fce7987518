package com.dinoair.resilience.failure;

import java.io.IOException;
import java.util.concurrent.CancellationException;

/**
 * Default mapping: caller cancellations are {@code CANCELLED}; timeouts, I/O errors, 5xx and 429 are
 * {@code TRANSIENT}; anything else, including other 4xx, is {@code NON_TRANSIENT}.
 */
public class DefaultErrorClassifier implements ErrorClassifier {

  public static final DefaultErrorClassifier INSTANCE = new DefaultErrorClassifier();

  @Override
  public ErrorCategory classify(Throwable error) {
    Throwable t = ErrorClassifier.unwrap(error);
    if (t instanceof CallCancelledException || t instanceof CancellationException)
      return ErrorCategory.CANCELLED;
    if (t instanceof CallTimeoutException || t instanceof IOException)
      return ErrorCategory.TRANSIENT;
    if (t instanceof DependencyException) {
      DependencyException de = (DependencyException) t;
      if (de.isServerError() || de.getStatusCode() == 429)
        return ErrorCategory.TRANSIENT;
      return ErrorCategory.NON_TRANSIENT;
    }
    if (t != null && t.getCause() instanceof IOException)
      return ErrorCategory.TRANSIENT;
    return ErrorCategory.NON_TRANSIENT;
  }
}
