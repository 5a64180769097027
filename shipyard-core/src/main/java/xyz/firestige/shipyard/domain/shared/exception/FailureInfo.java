package xyz.firestige.shipyard.domain.shared.exception;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 失败信息封装类
 * 统一封装命令被拒绝时的错误码、错误类型与上下文
 */
public class FailureInfo {

    /**
     * 稳定错误码，例如 target.url_already_taken
     */
    private String errorCode;

    /**
     * 错误消息
     */
    private String errorMessage;

    /**
     * 错误类型
     */
    private ErrorType errorType;

    /**
     * 上下文信息（聚合 ID 等）
     */
    private Map<String, Object> context = new LinkedHashMap<>();

    /**
     * 失败时间
     */
    private LocalDateTime timestamp;

    public FailureInfo() {
        this.timestamp = LocalDateTime.now();
    }

    public FailureInfo(String errorCode, String errorMessage, ErrorType errorType) {
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
        this.errorType = errorType;
        this.timestamp = LocalDateTime.now();
    }

    public static FailureInfo of(ErrorType errorType, String errorMessage) {
        return new FailureInfo(errorType.name(), errorMessage, errorType);
    }

    public static FailureInfo of(String errorCode, ErrorType errorType, String errorMessage, Map<String, Object> context) {
        FailureInfo info = new FailureInfo(errorCode, errorMessage, errorType);
        if (context != null) {
            info.context.putAll(context);
        }
        return info;
    }

    // Getters and Setters

    public String getErrorCode() {
        return errorCode;
    }

    public void setErrorCode(String errorCode) {
        this.errorCode = errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public void setErrorType(ErrorType errorType) {
        this.errorType = errorType;
    }

    public Map<String, Object> getContext() {
        return Collections.unmodifiableMap(context);
    }

    public LocalDateTime getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(LocalDateTime timestamp) {
        this.timestamp = timestamp;
    }

    @Override
    public String toString() {
        return "FailureInfo{" +
                "errorCode='" + errorCode + '\'' +
                ", errorMessage='" + errorMessage + '\'' +
                ", errorType=" + errorType +
                ", context=" + context +
                ", timestamp=" + timestamp +
                '}';
    }
}
