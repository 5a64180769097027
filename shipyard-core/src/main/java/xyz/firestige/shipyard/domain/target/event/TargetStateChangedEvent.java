package xyz.firestige.shipyard.domain.target.event;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.TargetState;

/**
 * 目标状态变更事件
 * <p>
 * 未提交缓冲区内至多存在一个，后产生的会替换先前的
 */
public class TargetStateChangedEvent extends TargetEvent {

    private final TargetState state;

    public TargetStateChangedEvent(TargetId targetId, TargetState state) {
        super(targetId);
        this.state = state;
        setMessage("目标状态变更为 " + state.getStatus());
    }

    public TargetState getState() {
        return state;
    }
}
