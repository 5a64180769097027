package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标处于 FAILED 状态且曾经可达，需由运维处理后才能继续
 */
public class TargetConfigurationFailedException extends InvalidTransitionException {

    public static final String ERROR_CODE = "target.configuration_failed";

    public TargetConfigurationFailedException(TargetId targetId) {
        super(ERROR_CODE, String.format("目标配置失败，需先修复: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
