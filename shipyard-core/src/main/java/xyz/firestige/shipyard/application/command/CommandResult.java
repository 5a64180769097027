package xyz.firestige.shipyard.application.command;

import xyz.firestige.shipyard.domain.shared.exception.FailureInfo;

import java.util.Optional;

/**
 * 命令执行结果
 * 成功时携带结果值，失败时携带 {@link FailureInfo}（稳定错误码 + 错误类型）
 */
public class CommandResult<R> {

    private final boolean success;
    private final R value;
    private final FailureInfo failureInfo;

    private CommandResult(boolean success, R value, FailureInfo failureInfo) {
        this.success = success;
        this.value = value;
        this.failureInfo = failureInfo;
    }

    // 静态工厂方法

    public static <R> CommandResult<R> success(R value) {
        return new CommandResult<>(true, value, null);
    }

    public static <R> CommandResult<R> failure(FailureInfo failureInfo) {
        return new CommandResult<>(false, null, failureInfo);
    }

    public boolean isSuccess() {
        return success;
    }

    /**
     * 成功结果值（{@link Void} 命令为 null）
     *
     * @throws IllegalStateException 结果为失败时调用
     */
    public R getValue() {
        if (!success) {
            throw new IllegalStateException("命令执行失败，没有结果值: " + failureInfo);
        }
        return value;
    }

    public Optional<FailureInfo> getFailureInfo() {
        return Optional.ofNullable(failureInfo);
    }

    /**
     * 失败时的错误码，成功时为 null
     */
    public String getErrorCode() {
        return failureInfo == null ? null : failureInfo.getErrorCode();
    }

    @Override
    public String toString() {
        return "CommandResult{" +
                "success=" + success +
                ", value=" + value +
                ", failureInfo=" + failureInfo +
                '}';
    }
}
