package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.ProviderConfig;
import xyz.firestige.shipyard.domain.target.TargetState;
import xyz.firestige.shipyard.domain.target.TargetUrl;

/**
 * 目标创建事件
 */
public class TargetCreatedEvent extends TargetEvent {

    private final String name;
    private final TargetUrl url;
    private final ProviderConfig provider;
    private final TargetState state;
    private final AuditStamp created;

    public TargetCreatedEvent(TargetId targetId, String name, TargetUrl url, ProviderConfig provider,
                              TargetState state, AuditStamp created) {
        super(targetId);
        this.name = name;
        this.url = url;
        this.provider = provider;
        this.state = state;
        this.created = created;
        setMessage("目标已创建: " + name + " (" + url + ")");
    }

    public String getName() {
        return name;
    }

    public TargetUrl getUrl() {
        return url;
    }

    public ProviderConfig getProvider() {
        return provider;
    }

    public TargetState getState() {
        return state;
    }

    public AuditStamp getCreated() {
        return created;
    }
}
