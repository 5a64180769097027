package xyz.firestige.shipyard.application.target;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.ProviderConfig;

/**
 * 更新目标，为 null 的字段保持不变
 */
public record UpdateTargetCommand(TargetId targetId, String name, String url, ProviderConfig provider)
        implements Command<TargetId> {
}
