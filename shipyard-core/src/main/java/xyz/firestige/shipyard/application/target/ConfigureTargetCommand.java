package xyz.firestige.shipyard.application.target;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

import java.time.Instant;

/**
 * 执行一次目标配置
 *
 * @param version 触发配置时目标的版本，过期版本直接跳过
 */
public record ConfigureTargetCommand(TargetId targetId, Instant version) implements Command<Void> {
}
