package xyz.firestige.shipyard.infrastructure.metrics;

import java.time.Duration;

/**
 * 未接入 Micrometer 时使用
 */
public class NoopMetricsRegistry implements MetricsRegistry {

    @Override
    public void incrementCounter(String name, String... tags) {
    }

    @Override
    public void recordTimer(String name, Duration duration, String... tags) {
    }
}
