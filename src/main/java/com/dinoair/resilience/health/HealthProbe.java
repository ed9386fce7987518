package com.dinoair.resilience.health;

import java.util.concurrent.CompletionStage;

/**
 * Lightweight check of one dependency, e.g. a GET on its tags or system-stats endpoint.
 */
@FunctionalInterface
public interface HealthProbe {

  CompletionStage<ProbeResult> check();
}
