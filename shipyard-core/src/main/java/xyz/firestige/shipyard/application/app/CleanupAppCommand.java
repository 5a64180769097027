package xyz.firestige.shipyard.application.app;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public record CleanupAppCommand(AppId appId) implements Command<Void> {
}
