package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.InvalidTransitionException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标已请求清理（终态条件），拒绝任何修改
 */
public class TargetCleanupRequestedException extends InvalidTransitionException {

    public static final String ERROR_CODE = "target.cleanup_requested";

    public TargetCleanupRequestedException(TargetId targetId) {
        super(ERROR_CODE, String.format("目标已请求清理，不再接受变更: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
