package xyz.firestige.shipyard.domain.deployment;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 部署执行状态（不可变）
 */
public final class DeploymentState {

    private final DeploymentStatus status;
    private final String errorCode;
    private final Instant startedAt;
    private final Instant finishedAt;

    private DeploymentState(DeploymentStatus status, String errorCode, Instant startedAt, Instant finishedAt) {
        this.status = status;
        this.errorCode = errorCode;
        this.startedAt = startedAt;
        this.finishedAt = finishedAt;
    }

    static DeploymentState pending() {
        return new DeploymentState(DeploymentStatus.PENDING, null, null, null);
    }

    DeploymentState started() {
        return new DeploymentState(DeploymentStatus.RUNNING, null, Instant.now(), null);
    }

    DeploymentState ended(String errorMessage) {
        DeploymentStatus next = errorMessage == null ? DeploymentStatus.SUCCEEDED : DeploymentStatus.FAILED;
        return new DeploymentState(next, errorMessage, startedAt, Instant.now());
    }

    public DeploymentStatus getStatus() {
        return status;
    }

    public Optional<String> getErrorCode() {
        return Optional.ofNullable(errorCode);
    }

    public Optional<Instant> getStartedAt() {
        return Optional.ofNullable(startedAt);
    }

    public Optional<Instant> getFinishedAt() {
        return Optional.ofNullable(finishedAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeploymentState that = (DeploymentState) o;
        return status == that.status
                && Objects.equals(errorCode, that.errorCode)
                && Objects.equals(startedAt, that.startedAt)
                && Objects.equals(finishedAt, that.finishedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(status, errorCode, startedAt, finishedAt);
    }

    @Override
    public String toString() {
        return "DeploymentState{status=" + status + ", errorCode='" + errorCode + "'}";
    }
}
