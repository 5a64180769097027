package xyz.firestige.shipyard.domain.shared.exception;

/**
 * 输入值校验失败异常基类
 */
public abstract class ValidationException extends DomainException {

    protected ValidationException(String errorCode, String message) {
        super(errorCode, message, ErrorType.VALIDATION_ERROR);
    }
}
