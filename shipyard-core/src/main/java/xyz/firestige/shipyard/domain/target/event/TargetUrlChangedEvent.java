package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.TargetUrl;

public class TargetUrlChangedEvent extends TargetEvent {

    private final TargetUrl url;

    public TargetUrlChangedEvent(TargetId targetId, TargetUrl url) {
        super(targetId);
        this.url = url;
        setMessage("目标 URL 已变更: " + url);
    }

    public TargetUrl getUrl() {
        return url;
    }
}
