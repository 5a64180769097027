package xyz.firestige.shipyard.domain.target;

import xyz.firestige.shipyard.domain.target.exception.ConfigAlreadyTakenException;

import java.util.Objects;

/**
 * Provider 配置唯一性约束
 */
public record ProviderConfigRequirement(ProviderConfig config, boolean unique) {

    public ProviderConfigRequirement {
        Objects.requireNonNull(config, "config cannot be null");
    }

    public ProviderConfig met() {
        if (!unique) {
            throw new ConfigAlreadyTakenException(config.fingerprint());
        }
        return config;
    }
}
