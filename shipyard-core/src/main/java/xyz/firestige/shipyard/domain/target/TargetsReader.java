package xyz.firestige.shipyard.domain.target;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 目标查询端：为聚合预先计算唯一性事实
 * <p>
 * 已删除的目标不参与唯一性判断
 */
public interface TargetsReader {

    /**
     * @param excluding 排除的目标（更新自身时传入），可为 null
     */
    TargetUrlRequirement checkUrlAvailability(TargetUrl url, TargetId excluding);

    /**
     * @param excluding 排除的目标（更新自身时传入），可为 null
     */
    ProviderConfigRequirement checkConfigAvailability(ProviderConfig config, TargetId excluding);

    /**
     * 目标存在且未删除
     */
    boolean exists(TargetId targetId);
}
