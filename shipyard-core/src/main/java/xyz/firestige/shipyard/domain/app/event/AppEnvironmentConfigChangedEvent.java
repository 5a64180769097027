package xyz.firestige.shipyard.domain.app.event;

import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public class AppEnvironmentConfigChangedEvent extends AppEvent {

    private final Environment environment;
    private final EnvironmentConfig config;

    public AppEnvironmentConfigChangedEvent(AppId appId, Environment environment, EnvironmentConfig config) {
        super(appId);
        this.environment = environment;
        this.config = config;
        setMessage("应用 " + environment + " 环境配置已变更, 目标: " + config.getTarget());
    }

    public Environment getEnvironment() {
        return environment;
    }

    public EnvironmentConfig getConfig() {
        return config;
    }
}
