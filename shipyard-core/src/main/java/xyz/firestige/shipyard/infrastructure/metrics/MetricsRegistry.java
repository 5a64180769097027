package xyz.firestige.shipyard.infrastructure.metrics;

import java.time.Duration;

public interface MetricsRegistry {

    /**
     * @param tags 键值交替排列的标签
     */
    void incrementCounter(String name, String... tags);

    void recordTimer(String name, Duration duration, String... tags);
}
