package xyz.firestige.shipyard.application.app;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public record UpdateAppEnvironmentCommand(AppId appId, Environment environment, EnvironmentConfig config)
        implements Command<Void> {
}
