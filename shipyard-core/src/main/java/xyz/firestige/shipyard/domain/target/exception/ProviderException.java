package xyz.firestige.shipyard.domain.target.exception;

import xyz.firestige.shipyard.domain.shared.exception.DomainException;
import xyz.firestige.shipyard.domain.shared.exception.ErrorType;

/**
 * Provider 调用失败（部署基础设施不可达、配置无法下发等）
 */
public class ProviderException extends DomainException {

    public static final String ERROR_CODE = "target.provider_failed";

    public ProviderException(String message) {
        super(ERROR_CODE, message, ErrorType.SERVICE_UNAVAILABLE);
    }

    public ProviderException(String message, Throwable cause) {
        super(ERROR_CODE, message, ErrorType.SERVICE_UNAVAILABLE, cause);
    }
}
