package com.dinoair.resilience.breaker;

/**
 * Notified after every state transition, outside the breaker's lock.
 */
@FunctionalInterface
public interface StateChangeListener {

    StateChangeListener NONE = transition -> { };

    void onStateChange(StateTransition transition);
}
