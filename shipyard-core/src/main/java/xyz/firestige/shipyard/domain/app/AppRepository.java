package xyz.firestige.shipyard.domain.app;

import xyz.firestige.shipyard.domain.shared.vo.AppId;

import java.util.List;
import java.util.Optional;

/**
 * App Repository 接口
 * <p>
 * 应用与其新产生的部署应在同一一致性边界内保存，以保证部署编号单调递增
 */
public interface AppRepository {

    void save(AppAggregate app);

    Optional<AppAggregate> findById(AppId appId);

    /**
     * 按名称查找未删除的应用
     */
    Optional<AppAggregate> findByName(AppName name);

    List<AppAggregate> findAll();
}
