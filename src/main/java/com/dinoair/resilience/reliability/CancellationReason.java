package com.dinoair.resilience.reliability;

public enum CancellationReason {
    /** The caller aborted, e.g. the user closed the chat. Never counts against a breaker. */
    CALLER,
    /** The supervisor gave up waiting. Always counts as a failure. */
    TIMEOUT
}
