package xyz.firestige.shipyard.domain.target;

import xyz.firestige.shipyard.domain.shared.event.AggregateRoot;
import xyz.firestige.shipyard.domain.shared.vo.AuditStamp;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.shared.vo.UserId;
import xyz.firestige.shipyard.domain.target.event.TargetCleanupRequestedEvent;
import xyz.firestige.shipyard.domain.target.event.TargetCreatedEvent;
import xyz.firestige.shipyard.domain.target.event.TargetDeletedEvent;
import xyz.firestige.shipyard.domain.target.event.TargetProviderChangedEvent;
import xyz.firestige.shipyard.domain.target.event.TargetRenamedEvent;
import xyz.firestige.shipyard.domain.target.event.TargetStateChangedEvent;
import xyz.firestige.shipyard.domain.target.event.TargetUrlChangedEvent;
import xyz.firestige.shipyard.domain.target.exception.ProviderUpdateNotPermittedException;
import xyz.firestige.shipyard.domain.target.exception.RunningOrPendingDeploymentsException;
import xyz.firestige.shipyard.domain.target.exception.TargetCleanupNeededException;
import xyz.firestige.shipyard.domain.target.exception.TargetCleanupRequestedException;
import xyz.firestige.shipyard.domain.target.exception.TargetConfigurationFailedException;
import xyz.firestige.shipyard.domain.target.exception.TargetConfigurationInProgressException;
import xyz.firestige.shipyard.domain.target.exception.TargetInUseException;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * 目标聚合（Target）
 * <p>
 * 职责：
 * 1. 管理目标的配置生命周期（CONFIGURING → READY / FAILED → 重新配置）
 * 2. 维护 URL、Provider 配置的唯一性与不可变约束（唯一性事实由调用方预先计算）
 * 3. 管理清理请求与删除
 * 4. 产生领域事件
 * <p>
 * 不变式：
 * - 一旦请求清理，不再接受任何变更（重命名、改 URL、改 Provider、重新配置）
 * - 未提交事件缓冲区中至多存在一个 {@link TargetStateChangedEvent}
 * - 旧版本的配置回报不会改变状态
 */
public class TargetAggregate extends AggregateRoot {

    private final TargetId targetId;
    private String name;
    private TargetUrl url;
    private ProviderConfig provider;
    private TargetState state;
    private AuditStamp cleanupRequested;
    private final AuditStamp created;
    private boolean deleted;

    private TargetAggregate(TargetId targetId, String name, TargetUrl url, ProviderConfig provider, AuditStamp created) {
        this.targetId = targetId;
        this.name = name;
        this.url = url;
        this.provider = provider;
        this.state = TargetState.configuring();
        this.created = created;
    }

    /**
     * 创建目标，URL 唯一性先于 Provider 配置唯一性检查
     *
     * @throws xyz.firestige.shipyard.domain.target.exception.UrlAlreadyTakenException URL 已被占用
     * @throws xyz.firestige.shipyard.domain.target.exception.ConfigAlreadyTakenException Provider 配置已被占用
     */
    public static TargetAggregate create(String name,
                                         TargetUrlRequirement urlRequirement,
                                         ProviderConfigRequirement configRequirement,
                                         UserId requestedBy) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("目标名称不能为空");
        }
        TargetUrl url = urlRequirement.met();
        ProviderConfig config = configRequirement.met();

        TargetAggregate target = new TargetAggregate(TargetId.generate(), name, url, config, AuditStamp.now(requestedBy));
        target.addDomainEvent(new TargetCreatedEvent(
                target.targetId, name, url, config, target.state, target.created));
        return target;
    }

    // ============================================
    // 变更
    // ============================================

    public void rename(String newName) {
        ensureNotCleanupRequested();

        if (Objects.equals(name, newName)) {
            return;
        }

        this.name = newName;
        addDomainEvent(new TargetRenamedEvent(targetId, newName));
    }

    /**
     * 变更 URL，变更后触发重新配置
     */
    public void hasUrl(TargetUrlRequirement requirement) {
        ensureNotCleanupRequested();

        TargetUrl newUrl = requirement.met();
        if (url.equals(newUrl)) {
            return;
        }

        this.url = newUrl;
        addDomainEvent(new TargetUrlChangedEvent(targetId, newUrl));
        applyReconfigure();
    }

    /**
     * 变更 Provider 配置，指纹不可变；变更后触发重新配置
     */
    public void hasProvider(ProviderConfigRequirement requirement) {
        ensureNotCleanupRequested();

        ProviderConfig newConfig = requirement.met();
        ensureSameFingerprint(newConfig);
        if (provider.equals(newConfig)) {
            return;
        }

        this.provider = newConfig;
        addDomainEvent(new TargetProviderChangedEvent(targetId, newConfig));
        applyReconfigure();
    }

    /**
     * 一次更新名称、URL、Provider 配置，为 null 的项保持不变
     * <p>
     * 全部约束先行校验，任一约束不满足时不修改状态、不产生事件
     */
    public void update(String newName, TargetUrlRequirement urlRequirement, ProviderConfigRequirement configRequirement) {
        ensureNotCleanupRequested();
        if (urlRequirement != null) {
            urlRequirement.met();
        }
        if (configRequirement != null) {
            ensureSameFingerprint(configRequirement.met());
        }

        if (newName != null) {
            rename(newName);
        }
        if (urlRequirement != null) {
            hasUrl(urlRequirement);
        }
        if (configRequirement != null) {
            hasProvider(configRequirement);
        }
    }

    /**
     * 手动触发重新配置
     */
    public void reconfigure() {
        ensureNotCleanupRequested();
        if (state.getStatus() == TargetStatus.CONFIGURING) {
            throw new TargetConfigurationInProgressException(targetId);
        }
        applyReconfigure();
    }

    /**
     * Provider 回报配置结果
     *
     * @param version 发起配置时的版本
     * @param errorMessage 失败原因，成功时为 null
     */
    public void configured(Instant version, String errorMessage) {
        Optional<TargetState> next = state.configured(version, errorMessage);
        if (next.isEmpty()) {
            return;
        }

        TargetState previous = this.state;
        this.state = next.get();
        if (previous.differsFrom(state)) {
            replaceDomainEvent(new TargetStateChangedEvent(targetId, state));
        }
    }

    private void applyReconfigure() {
        this.state = state.reconfigured();
        replaceDomainEvent(new TargetStateChangedEvent(targetId, state));
    }

    // ============================================
    // 可用性与清理
    // ============================================

    /**
     * 部署前检查目标是否可用
     */
    public void checkAvailability() {
        ensureNotCleanupRequested();
        switch (state.getStatus()) {
            case CONFIGURING:
                throw new TargetConfigurationInProgressException(targetId);
            case FAILED:
                throw new TargetConfigurationFailedException(targetId);
            default:
                break;
        }
    }

    /**
     * 请求清理，重复请求无副作用
     *
     * @param usedByAnyApp 是否仍有应用的环境绑定引用本目标
     */
    public void requestCleanup(boolean usedByAnyApp, UserId requestedBy) {
        if (cleanupRequested != null) {
            return;
        }
        if (state.getStatus() == TargetStatus.CONFIGURING) {
            throw new TargetConfigurationInProgressException(targetId);
        }
        if (usedByAnyApp) {
            throw new TargetInUseException(targetId);
        }

        this.cleanupRequested = AuditStamp.now(requestedBy);
        addDomainEvent(new TargetCleanupRequestedEvent(targetId, cleanupRequested));
    }

    /**
     * 决定目标本身的清理策略
     */
    public CleanupStrategy cleanupStrategy(boolean hasRunningOrPendingDeployments) {
        if (state.getStatus() == TargetStatus.CONFIGURING) {
            throw new TargetConfigurationInProgressException(targetId);
        }
        if (hasRunningOrPendingDeployments) {
            throw new RunningOrPendingDeploymentsException(targetId);
        }
        if (state.getStatus() == TargetStatus.READY) {
            return CleanupStrategy.DEFAULT;
        }
        // FAILED：从未成功配置过或已不可再修改时，没有资源可回收
        if (!state.hasBeenReady() || cleanupRequested != null) {
            return CleanupStrategy.SKIP;
        }
        throw new TargetConfigurationFailedException(targetId);
    }

    /**
     * 决定清理某个应用在本目标上资源的策略
     */
    public CleanupStrategy appCleanupStrategy(boolean hasRunningOrPendingDeployments, boolean hasSucceededDeployment) {
        if (hasRunningOrPendingDeployments) {
            throw new RunningOrPendingDeploymentsException(targetId);
        }
        if (!hasSucceededDeployment || cleanupRequested != null) {
            return CleanupStrategy.SKIP;
        }
        switch (state.getStatus()) {
            case CONFIGURING:
                throw new TargetConfigurationInProgressException(targetId);
            case FAILED:
                throw new TargetConfigurationFailedException(targetId);
            default:
                return CleanupStrategy.DEFAULT;
        }
    }

    /**
     * 删除目标（终态）
     *
     * @param resourcesCleanedUp Provider 是否已回收目标资源
     */
    public void delete(boolean resourcesCleanedUp) {
        if (cleanupRequested == null || !resourcesCleanedUp) {
            throw new TargetCleanupNeededException(targetId);
        }
        if (deleted) {
            return;
        }

        this.deleted = true;
        addDomainEvent(new TargetDeletedEvent(targetId));
    }

    private void ensureSameFingerprint(ProviderConfig newConfig) {
        if (!Objects.equals(provider.fingerprint(), newConfig.fingerprint())) {
            throw new ProviderUpdateNotPermittedException(targetId);
        }
    }

    private void ensureNotCleanupRequested() {
        if (cleanupRequested != null) {
            throw new TargetCleanupRequestedException(targetId);
        }
    }

    // ============================================
    // Getters
    // ============================================

    public TargetId getTargetId() {
        return targetId;
    }

    public String getName() {
        return name;
    }

    public TargetUrl getUrl() {
        return url;
    }

    public ProviderConfig getProvider() {
        return provider;
    }

    public TargetState getState() {
        return state;
    }

    public Instant getCurrentVersion() {
        return state.getVersion();
    }

    public Optional<AuditStamp> getCleanupRequested() {
        return Optional.ofNullable(cleanupRequested);
    }

    public boolean isCleanupRequested() {
        return cleanupRequested != null;
    }

    public AuditStamp getCreated() {
        return created;
    }

    public boolean isDeleted() {
        return deleted;
    }

    @Override
    public String toString() {
        return "TargetAggregate{" +
                "targetId=" + targetId +
                ", name='" + name + '\'' +
                ", url=" + url +
                ", state=" + state +
                ", cleanupRequested=" + (cleanupRequested != null) +
                '}';
    }
}
