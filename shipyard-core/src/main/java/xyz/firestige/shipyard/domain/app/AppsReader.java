package xyz.firestige.shipyard.domain.app;

import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;

/**
 * 应用查询端
 */
public interface AppsReader {

    /**
     * 应用名在目标上是否可用（没有其他未删除的同名应用绑定到该目标）
     *
     * @param excluding 排除的应用，可为 null
     */
    boolean isNameAvailableOnTarget(AppName name, TargetId target, AppId excluding);

    /**
     * 是否仍有未删除应用的任一环境绑定到该目标
     */
    boolean isTargetUsed(TargetId target);
}
