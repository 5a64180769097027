package xyz.firestige.shipyard.application.deployment;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

/**
 * 将应用的某个部署晋升到生产环境，结果为新部署的编号
 *
 * @param deploymentNumber 源部署编号
 */
public record PromoteCommand(AppId appId, int deploymentNumber) implements Command<Integer> {
}
