package xyz.firestige.shipyard.domain.target;

import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.target.exception.ProviderException;

/**
 * 部署基础设施 Provider 端口（docker 等）
 * <p>
 * 实现方负责真正的资源下发与回收，核心只根据结果推进状态
 */
public interface TargetProvider {

    /**
     * 按目标当前配置下发基础设施
     *
     * @throws ProviderException 下发失败
     */
    void setup(TargetAggregate target);

    /**
     * 回收目标上的所有资源，策略为 SKIP 时实现方可直接返回
     *
     * @throws ProviderException 回收失败
     */
    void cleanupTarget(TargetAggregate target, CleanupStrategy strategy);

    /**
     * 回收某个应用在目标上某个环境的资源
     *
     * @throws ProviderException 回收失败
     */
    void cleanupApp(TargetAggregate target, AppId appId, AppName appName, Environment environment, CleanupStrategy strategy);
}
