package xyz.firestige.shipyard.domain.target;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 目标配置状态（不可变）
 * <p>
 * version 标识一次配置请求，Provider 回报时携带该版本，旧版本的回报会被忽略。
 * lastReadyVersion 记录最近一次配置成功的版本，重新配置不会清除它，
 * 用于判断目标是否"曾经可达"。
 */
public final class TargetState {

    private final TargetStatus status;
    private final Instant version;
    private final String errorCode;
    private final Instant lastReadyVersion;

    private TargetState(TargetStatus status, Instant version, String errorCode, Instant lastReadyVersion) {
        this.status = Objects.requireNonNull(status, "status cannot be null");
        this.version = Objects.requireNonNull(version, "version cannot be null");
        this.errorCode = errorCode;
        this.lastReadyVersion = lastReadyVersion;
    }

    /**
     * 新建目标的初始状态
     */
    public static TargetState configuring() {
        return new TargetState(TargetStatus.CONFIGURING, Instant.now(), null, null);
    }

    /**
     * 重新配置：生成严格递增的新版本，清除错误
     */
    TargetState reconfigured() {
        Instant now = Instant.now();
        Instant next = now.isAfter(version) ? now : version.plusNanos(1);
        return new TargetState(TargetStatus.CONFIGURING, next, null, lastReadyVersion);
    }

    /**
     * Provider 回报配置结果
     *
     * @return 版本过期时返回 empty
     */
    Optional<TargetState> configured(Instant reportedVersion, String errorMessage) {
        if (reportedVersion.isBefore(version)) {
            return Optional.empty();
        }
        if (errorMessage != null) {
            return Optional.of(new TargetState(TargetStatus.FAILED, version, errorMessage, lastReadyVersion));
        }
        return Optional.of(new TargetState(TargetStatus.READY, version, null, reportedVersion));
    }

    /**
     * 状态或错误是否不同（版本变化不计入）
     */
    boolean differsFrom(TargetState other) {
        return status != other.status || !Objects.equals(errorCode, other.errorCode);
    }

    public boolean isOutdated(Instant reportedVersion) {
        return reportedVersion.isBefore(version);
    }

    public boolean hasBeenReady() {
        return lastReadyVersion != null;
    }

    public TargetStatus getStatus() {
        return status;
    }

    public Instant getVersion() {
        return version;
    }

    public Optional<String> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }

    public Optional<Instant> getLastReadyVersion() {
        return Optional.ofNullable(lastReadyVersion);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetState that = (TargetState) o;
        return status == that.status
                && version.equals(that.version)
                && Objects.equals(errorCode, that.errorCode)
                && Objects.equals(lastReadyVersion, that.lastReadyVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, version, errorCode, lastReadyVersion);
    }

    @Override
    public String toString() {
        return "TargetState{" +
                "status=" + status +
                ", version=" + version +
                ", errorCode='" + errorCode + '\'' +
                '}';
    }
}
