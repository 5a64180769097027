package xyz.firestige.shipyard.domain.shared.exception;

/**
 * 状态不允许当前操作时抛出的异常基类
 */
public abstract class InvalidTransitionException extends DomainException {

    protected InvalidTransitionException(String errorCode, String message) {
        super(errorCode, message, ErrorType.INVALID_TRANSITION);
    }
}
