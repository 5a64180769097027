package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

public class TargetCleanupRequestedEvent extends TargetEvent {

    private final AuditStamp requested;

    public TargetCleanupRequestedEvent(TargetId targetId, AuditStamp requested) {
        super(targetId);
        this.requested = requested;
        setMessage("目标已请求清理, by: " + requested.by());
    }

    public AuditStamp getRequested() {
        return requested;
    }
}
