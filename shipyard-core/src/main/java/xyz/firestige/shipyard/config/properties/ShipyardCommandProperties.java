package xyz.firestige.shipyard.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 命令总线配置属性
 */
@ConfigurationProperties(prefix = "shipyard.command")
public class ShipyardCommandProperties {

    /**
     * 慢命令阈值，超过后以 warn 级别记录（默认 5 秒）
     */
    private Duration slowThreshold = Duration.ofSeconds(5);

    public Duration getSlowThreshold() {
        return slowThreshold;
    }

    public void setSlowThreshold(Duration slowThreshold) {
        this.slowThreshold = slowThreshold;
    }
}
