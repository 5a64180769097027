package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标事件基类
 */
public abstract class TargetEvent extends DomainEvent {

    private final TargetId targetId;

    protected TargetEvent(TargetId targetId) {
        super();
        this.targetId = targetId;
    }

    public TargetId getTargetId() {
        return targetId;
    }

    @Override
    public String getAggregateId() {
        return targetId.getValue();
    }
}
