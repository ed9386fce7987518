package com.dinoair.resilience.failure;

/**
 * The caller gave up on the call, e.g. the user closed the chat.
 */
public class CallCancelledException extends RuntimeException {

  public CallCancelledException() {
    super("Cancelled by caller");
  }

  public CallCancelledException(String message) {
    super(message);
  }
}
