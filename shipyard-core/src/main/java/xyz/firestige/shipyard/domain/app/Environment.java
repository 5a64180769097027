package xyz.firestige.shipyard.domain.app;

import xyz.firestige.shipyard.domain.app.exception.InvalidEnvironmentException;

import java.util.Locale;

/**
 * 逻辑部署环境
 */
public enum Environment {

    PRODUCTION("生产"),

    STAGING("预发");

    private final String description;

    Environment(String description) {
        this.description = description;
    }

    /**
     * 不区分大小写解析
     */
    public static Environment parse(String raw) {
        if (raw == null) {
            throw new InvalidEnvironmentException(null);
        }
        try {
            return Environment.valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidEnvironmentException(raw);
        }
    }

    public String getDescription() {
        return description;
    }
}
