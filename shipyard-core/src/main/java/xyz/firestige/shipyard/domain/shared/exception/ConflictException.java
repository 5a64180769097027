package xyz.firestige.shipyard.domain.shared.exception;

/**
 * 唯一性冲突异常基类
 */
public abstract class ConflictException extends DomainException {

    protected ConflictException(String errorCode, String message) {
        super(errorCode, message, ErrorType.CONFLICT);
    }
}
