package com.dinoair.resilience.breaker;

import java.time.Duration;

/**
 * Tuned breaker settings for the services the chat back end calls. All of them keep
 * {@link CircuitBreakerConfig#DEFAULT_IS_FAILURE}, so a missing model (404) or a rejected prompt
 * (400, 422) never trips a breaker.
 */
public final class DependencyPresets {
    /** Text-generation daemon. */
    public static final String OLLAMA = "ollama";
    /** Image-generation daemon. */
    public static final String COMFYUI = "comfyui";
    public static final String MODEL_DOWNLOAD = "model-download";

    private DependencyPresets() {
    }

    public static CircuitBreakerConfig ollama() {
        return CircuitBreakerConfig.newBuilder()
            .failureThreshold(5)
            .successThreshold(3)
            .timeout(Duration.ofMinutes(1))
            .resetTimeout(Duration.ofSeconds(20))
            .slowCallDuration(Duration.ofSeconds(10))
            .slowCallRateThreshold(0.5)
            .build();
    }

    public static CircuitBreakerConfig comfyUi() {
        return CircuitBreakerConfig.newBuilder()
            .failureThreshold(3)
            .successThreshold(2)
            .timeout(Duration.ofMinutes(2))
            .resetTimeout(Duration.ofSeconds(30))
            .slowCallDuration(Duration.ofSeconds(30))
            .slowCallRateThreshold(0.7)
            .build();
    }

    public static CircuitBreakerConfig modelDownload() {
        return CircuitBreakerConfig.newBuilder()
            .failureThreshold(2)
            .successThreshold(1)
            .timeout(Duration.ofMinutes(10))
            .resetTimeout(Duration.ofMinutes(2))
            .slowCallDuration(Duration.ofMinutes(1))
            .slowCallRateThreshold(0.8)
            .build();
    }
}
