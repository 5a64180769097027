package xyz.firestige.shipyard.domain.shared.exception;

/**
 * 资源不存在异常基类（应用、目标、部署）
 */
public abstract class NotFoundException extends DomainException {

    protected NotFoundException(String errorCode, String message) {
        super(errorCode, message, ErrorType.NOT_FOUND);
    }
}
