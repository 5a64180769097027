package xyz.firestige.shipyard.application.target;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

public record ReconfigureTargetCommand(TargetId targetId) implements Command<Void> {
}
