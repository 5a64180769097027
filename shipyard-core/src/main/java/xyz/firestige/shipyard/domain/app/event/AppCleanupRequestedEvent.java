package xyz.firestige.shipyard.domain.app.event;

import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;

public class AppCleanupRequestedEvent extends AppEvent {

    private final AuditStamp requested;

    public AppCleanupRequestedEvent(AppId appId, AuditStamp requested) {
        super(appId);
        this.requested = requested;
        setMessage("应用已请求清理, by: " + requested.by());
    }

    public AuditStamp getRequested() {
        return requested;
    }
}
