package xyz.firestige.shipyard.application.app;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public record CreateAppCommand(String name, EnvironmentConfig production, EnvironmentConfig staging)
        implements Command<AppId> {
}
