package xyz.firestige.shipyard.application.deployment;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.deployment.SourceData;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

/**
 * 排队一个新部署，结果为分配的部署编号
 */
public record QueueDeploymentCommand(AppId appId, Environment environment, SourceData source)
        implements Command<Integer> {
}
