package xyz.firestige.shipyard.application.deployment;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

public record StartDeploymentCommand(AppId appId, int deploymentNumber) implements Command<Void> {
}
