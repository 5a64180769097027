package xyz.firestige.shipyard.domain.shared.exception;

/**
 * 前置条件不满足异常基类
 */
public abstract class PreconditionException extends DomainException {

    protected PreconditionException(String errorCode, String message) {
        super(errorCode, message, ErrorType.PRECONDITION);
    }
}
