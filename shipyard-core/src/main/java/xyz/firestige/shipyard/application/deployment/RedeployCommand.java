package xyz.firestige.shipyard.application.deployment;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

/**
 * 在原环境上重新部署，结果为新部署的编号
 */
public record RedeployCommand(AppId appId, int deploymentNumber) implements Command<Integer> {
}
