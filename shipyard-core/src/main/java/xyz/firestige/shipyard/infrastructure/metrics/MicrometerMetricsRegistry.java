package xyz.firestige.shipyard.infrastructure.metrics;

import io.micrometer.core.instrument.MeterRegistry;

import java.time.Duration;

public class MicrometerMetricsRegistry implements MetricsRegistry {

    private final MeterRegistry registry;

    public MicrometerMetricsRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void incrementCounter(String name, String... tags) {
        registry.counter(name, tags).increment();
    }

    @Override
    public void recordTimer(String name, Duration duration, String... tags) {
        registry.timer(name, tags).record(duration);
    }
}
