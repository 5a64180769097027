package xyz.firestige.shipyard.domain.app;

import xyz.firestige.shipyard.domain.app.exception.AppNameAlreadyTakenException;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;

import java.util.Objects;

/**
 * 环境配置约束
 *
 * @param config 候选配置
 * @param targetExists 绑定的目标是否存在（且未删除）
 * @param available 应用名在该目标上是否可用
 * @param name 用于失败时报告的应用名
 */
public record EnvironmentConfigRequirement(EnvironmentConfig config, boolean targetExists, boolean available, AppName name) {

    public EnvironmentConfigRequirement {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
    }

    public EnvironmentConfig met() {
        if (!targetExists) {
            throw new TargetNotFoundException(config.getTarget());
        }
        if (!available) {
            throw new AppNameAlreadyTakenException(name);
        }
        return config;
    }
}
