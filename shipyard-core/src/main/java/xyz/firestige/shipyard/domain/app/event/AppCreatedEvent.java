package xyz.firestige.shipyard.domain.app.event;

import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;

public class AppCreatedEvent extends AppEvent {

    private final AppName name;
    private final EnvironmentConfig production;
    private final EnvironmentConfig staging;
    private final AuditStamp created;

    public AppCreatedEvent(AppId appId, AppName name, EnvironmentConfig production, EnvironmentConfig staging,
                           AuditStamp created) {
        super(appId);
        this.name = name;
        this.production = production;
        this.staging = staging;
        this.created = created;
        setMessage("应用已创建: " + name);
    }

    public AppName getName() {
        return name;
    }

    public EnvironmentConfig getProduction() {
        return production;
    }

    public EnvironmentConfig getStaging() {
        return staging;
    }

    public AuditStamp getCreated() {
        return created;
    }
}
