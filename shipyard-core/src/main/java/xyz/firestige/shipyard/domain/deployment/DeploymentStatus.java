package xyz.firestige.shipyard.domain.deployment;

/**
 * 部署状态，由外部执行层驱动
 */
public enum DeploymentStatus {

    PENDING("排队中"),

    RUNNING("运行中"),

    SUCCEEDED("成功"),

    FAILED("失败");

    private final String description;

    DeploymentStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isRunningOrPending() {
        return this == PENDING || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
