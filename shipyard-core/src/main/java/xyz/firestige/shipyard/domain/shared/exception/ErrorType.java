package xyz.firestige.shipyard.domain.shared.exception;

/**
 * 错误类型枚举
 * 调用方（API 层）据此映射状态码，无需解析错误消息
 */
public enum ErrorType {

    /**
     * 应用、目标或部署不存在
     */
    NOT_FOUND("资源不存在"),

    /**
     * 唯一性冲突（URL、Provider 配置、应用名）
     */
    CONFLICT("唯一性冲突"),

    /**
     * 当前状态不允许该操作
     */
    INVALID_TRANSITION("非法状态转换"),

    /**
     * 前置条件不满足（仍被使用、仍有运行中部署、资源未清理）
     */
    PRECONDITION("前置条件不满足"),

    /**
     * 数据校验错误
     */
    VALIDATION_ERROR("校验错误"),

    /**
     * 外部 Provider 不可用或调用失败
     */
    SERVICE_UNAVAILABLE("服务不可用"),

    /**
     * 系统错误
     */
    SYSTEM_ERROR("系统错误");

    private final String description;

    ErrorType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
