package xyz.firestige.shipyard.domain.target;

/**
 * 清理策略
 */
public enum CleanupStrategy {

    /**
     * 正常清理，需要 Provider 回收资源
     */
    DEFAULT,

    /**
     * 没有任何资源需要回收，直接跳过 Provider
     */
    SKIP
}
