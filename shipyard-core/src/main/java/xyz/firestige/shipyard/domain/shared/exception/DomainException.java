package xyz.firestige.shipyard.domain.shared.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 领域异常基类
 * <p>
 * 聚合与命令处理器拒绝操作时抛出，携带稳定的错误码与错误类型。
 * 命令总线负责将其转换为 {@link FailureInfo}，不会越过核心边界。
 */
public class DomainException extends RuntimeException {

    /**
     * 稳定错误码
     */
    private final String errorCode;

    /**
     * 错误类型
     */
    private final ErrorType errorType;

    /**
     * 上下文信息
     */
    private final Map<String, Object> context = new LinkedHashMap<>();

    public DomainException(String errorCode, String message, ErrorType errorType) {
        super(message);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    public DomainException(String errorCode, String message, ErrorType errorType, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.errorType = errorType;
    }

    /**
     * 添加上下文信息
     */
    public DomainException addContext(String key, Object value) {
        this.context.put(key, value);
        return this;
    }

    /**
     * 转换为 FailureInfo
     */
    public FailureInfo toFailureInfo() {
        return FailureInfo.of(errorCode, errorType, getMessage(), context);
    }

    public String getErrorCode() {
        return errorCode;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public Map<String, Object> getContext() {
        return context;
    }
}
