package com.dinoair.resilience.breaker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.dinoair.resilience.metrics.MetricPublisher;
import com.dinoair.resilience.metrics.NoOpMetricPublisher;
import com.dinoair.resilience.scheduling.Scheduler;

/**
 * One breaker per dependency name. Created by the process's startup code and handed to the
 * supervisor and the health aggregator; there are no static breakers.
 */
public class CircuitBreakerRegistry implements AutoCloseable {
    private final Scheduler scheduler;
    private final MetricPublisher metrics;
    private final ConcurrentHashMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();

    public CircuitBreakerRegistry(Scheduler scheduler) {
        this(scheduler, NoOpMetricPublisher.INSTANCE);
    }

    public CircuitBreakerRegistry(Scheduler scheduler, MetricPublisher metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.metrics = metrics == null ? NoOpMetricPublisher.INSTANCE : metrics;
    }

    /** Registry holding the text-generation, image-generation and model-download breakers. */
    public static CircuitBreakerRegistry withDefaults(Scheduler scheduler, MetricPublisher metrics) {
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(scheduler, metrics);
        registry.register(DependencyPresets.OLLAMA, DependencyPresets.ollama());
        registry.register(DependencyPresets.COMFYUI, DependencyPresets.comfyUi());
        registry.register(DependencyPresets.MODEL_DOWNLOAD, DependencyPresets.modelDownload());
        return registry;
    }

    /**
     * @throws IllegalStateException if a breaker with that name already exists
     */
    public CircuitBreaker register(String name, CircuitBreakerConfig config) {
        CircuitBreaker created = new CircuitBreaker(name, config, scheduler, metrics);
        CircuitBreaker existing = breakers.putIfAbsent(name, created);
        if (existing != null) {
            created.stop();
            throw new IllegalStateException("Circuit breaker already registered: " + name);
        }
        return created;
    }

    /**
     * @throws IllegalArgumentException if no breaker is registered under {@code name}
     */
    public CircuitBreaker get(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null)
            throw new IllegalArgumentException("No circuit breaker registered for dependency " + name);
        return breaker;
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    /** Sorted by name. */
    public Collection<CircuitBreaker> all() {
        List<CircuitBreaker> list = new ArrayList<>(breakers.values());
        list.sort((a, b) -> a.getName().compareTo(b.getName()));
        return Collections.unmodifiableList(list);
    }

    public Map<String, CircuitBreakerSnapshot> snapshots() {
        Map<String, CircuitBreakerSnapshot> out = new LinkedHashMap<>();
        for (CircuitBreaker b : all())
            out.put(b.getName(), b.snapshot());
        return out;
    }

    public void stopAll() {
        breakers.values().forEach(CircuitBreaker::stop);
    }

    @Override
    public void close() {
        stopAll();
    }
}
