package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;

public class TargetRenamedEvent extends TargetEvent {

    private final String name;

    public TargetRenamedEvent(TargetId targetId, String name) {
        super(targetId);
        this.name = name;
        setMessage("目标已重命名: " + name);
    }

    public String getName() {
        return name;
    }
}
