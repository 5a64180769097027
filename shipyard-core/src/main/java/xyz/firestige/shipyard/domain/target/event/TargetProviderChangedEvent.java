package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.ProviderConfig;

public class TargetProviderChangedEvent extends TargetEvent {

    private final ProviderConfig provider;

    public TargetProviderChangedEvent(TargetId targetId, ProviderConfig provider) {
        super(targetId);
        this.provider = provider;
        setMessage("目标 Provider 配置已变更, kind: " + provider.kind());
    }

    public ProviderConfig getProvider() {
        return provider;
    }
}
