package xyz.firestige.shipyard.application.app;

import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.AppsReader;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.app.EnvironmentConfigRequirement;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.target.TargetsReader;

/**
 * 组装环境配置约束：目标是否存在 + 应用名在目标上是否可用
 */
class EnvironmentRequirementResolver {

    private final AppsReader appsReader;
    private final TargetsReader targetsReader;

    EnvironmentRequirementResolver(AppsReader appsReader, TargetsReader targetsReader) {
        this.appsReader = appsReader;
        this.targetsReader = targetsReader;
    }

    EnvironmentConfigRequirement resolve(AppName name, EnvironmentConfig config, AppId excluding) {
        return new EnvironmentConfigRequirement(
                config,
                targetsReader.exists(config.getTarget()),
                appsReader.isNameAvailableOnTarget(name, config.getTarget(), excluding),
                name);
    }
}
