package xyz.firestige.shipyard.domain.app.event;

import xyz.firestige.shipyard.domain.shared.vo.AppId;

public class AppDeletedEvent extends AppEvent {

    public AppDeletedEvent(AppId appId) {
        super(appId);
        setMessage("应用已删除");
    }
}
