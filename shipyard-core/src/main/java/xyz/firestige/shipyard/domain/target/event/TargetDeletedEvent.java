package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;

public class TargetDeletedEvent extends TargetEvent {

    public TargetDeletedEvent(TargetId targetId) {
        super(targetId);
        setMessage("目标已删除");
    }
}
