package xyz.firestige.shipyard.application.deployment;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

/**
 * @param errorMessage 失败原因，成功时为 null
 */
public record FinishDeploymentCommand(AppId appId, int deploymentNumber, String errorMessage)
        implements Command<Void> {
}
