package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标处于 CONFIGURING 状态，操作被拒绝
 */
public class TargetConfigurationInProgressException extends InvalidTransitionException {

    public static final String ERROR_CODE = "target.configuration_in_progress";

    public TargetConfigurationInProgressException(TargetId targetId) {
        super(ERROR_CODE, String.format("目标正在配置中: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
