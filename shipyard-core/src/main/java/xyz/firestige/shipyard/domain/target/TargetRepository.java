package xyz.firestige.shipyard.domain.target;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;

import java.util.List;
import java.util.Optional;

/**
 * Target Repository 接口
 * <p>
 * 保存成功后负责发布聚合缓冲区中的领域事件并清空缓冲区。
 * 乐观并发控制（版本号 / ETag）由持久化实现负责。
 */
public interface TargetRepository {

    void save(TargetAggregate target);

    Optional<TargetAggregate> findById(TargetId targetId);

    List<TargetAggregate> findAll();
}
