package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.NotFoundException;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标不存在
 */
public class TargetNotFoundException extends NotFoundException {

    public static final String ERROR_CODE = "target.not_found";

    public TargetNotFoundException(TargetId targetId) {
        super(ERROR_CODE, String.format("目标不存在: %s", targetId));
        addContext("targetId", String.valueOf(targetId));
    }
}
