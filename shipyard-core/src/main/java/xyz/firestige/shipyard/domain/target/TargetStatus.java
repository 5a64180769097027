package xyz.firestige.shipyard.domain.target;

/**
 * 目标配置状态
 */
public enum TargetStatus {

    /**
     * 配置中（新建或重新配置后，等待 Provider 回报）
     */
    CONFIGURING("配置中"),

    /**
     * 已就绪，可接收部署
     */
    READY("已就绪"),

    /**
     * 配置失败
     */
    FAILED("配置失败");

    private final String description;

    TargetStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
