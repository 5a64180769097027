package xyz.firestige.shipyard.domain.app.event;

import xyz.firestige.shipyard.domain.shared.event.DomainEvent;
import xyz.firestige.shipyard.domain.shared.vo.AppId;

/**
 * 应用事件基类
 */
public abstract class AppEvent extends DomainEvent {

    private final AppId appId;

    protected AppEvent(AppId appId) {
        super();
        this.appId = appId;
    }

    public AppId getAppId() {
        return appId;
    }

    @Override
    public String getAggregateId() {
        return appId.getValue();
    }
}
