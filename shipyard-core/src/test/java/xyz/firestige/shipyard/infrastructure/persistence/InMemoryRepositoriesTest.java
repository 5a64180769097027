package xyz.firestige.shipyard.infrastructure.persistence;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.deployment.DeploymentAggregate;
import xyz.firestige.shipyard.domain.shared.vo.AppId;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetUrl;
import xyz.firestige.shipyard.domain.target.event.TargetCreatedEvent;
import xyz.firestige.shipyard.testutil.DummyProviderConfig;
import xyz.firestige.shipyard.testutil.InMemoryFixture;
import xyz.firestige.shipyard.testutil.TimingExtension;
import xyz.firestige.shipyard.testutil.factory.DomainTestFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * 内存仓储与只读查询测试
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("内存仓储测试")
class InMemoryRepositoriesTest {

    private InMemoryFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryFixture();
    }

    private void deleteTarget(TargetAggregate target) {
        target.requestCleanup(false, fixture.context.getRequester());
        target.delete(true);
        fixture.targets.save(target);
    }

    // ============================================
    // 目标
    // ============================================

    @Test
    @DisplayName("场景: 保存时发布并清空未提交事件")
    void shouldPublishAndClearEventsOnSave() {
        TargetAggregate target = DomainTestFactory.newTarget();

        fixture.targets.save(target);

        assertThat(target.getDomainEvents()).isEmpty();
        assertThat(fixture.events.getEventsOfType(TargetCreatedEvent.class)).hasSize(1);
        assertEquals(target, fixture.targets.findById(target.getTargetId()).orElseThrow());
        assertThrows(IllegalArgumentException.class, () -> fixture.targets.save(null));
    }

    @Test
    @DisplayName("场景: URL 与配置唯一性检查排除自身与已删除目标")
    void shouldCheckTargetUniqueness() {
        // Given
        TargetAggregate target = fixture.readyTarget();
        TargetUrl url = target.getUrl();
        DummyProviderConfig sameFingerprint = new DummyProviderConfig("other", target.getProvider().fingerprint());

        // Then
        assertFalse(fixture.targets.checkUrlAvailability(url, null).unique());
        assertTrue(fixture.targets.checkUrlAvailability(url, target.getTargetId()).unique());
        assertFalse(fixture.targets.checkConfigAvailability(sameFingerprint, null).unique());
        assertTrue(fixture.targets.checkConfigAvailability(DomainTestFactory.randomConfig(), null).unique());

        // When
        deleteTarget(target);

        // Then
        assertTrue(fixture.targets.checkUrlAvailability(url, null).unique());
        assertTrue(fixture.targets.checkConfigAvailability(sameFingerprint, null).unique());
        assertFalse(fixture.targets.exists(target.getTargetId()));
        assertThat(fixture.targets.findAll()).hasSize(1);
    }

    // ============================================
    // 应用
    // ============================================

    @Test
    @DisplayName("场景: 应用名在目标上的可用性与目标使用情况")
    void shouldCheckAppNameAndTargetUsage() {
        // Given
        TargetAggregate target = fixture.readyTarget();
        TargetId otherTarget = TargetId.generate();
        AppAggregate app = fixture.app(target.getTargetId());

        // Then
        assertFalse(fixture.apps.isNameAvailableOnTarget(app.getName(), target.getTargetId(), null));
        assertTrue(fixture.apps.isNameAvailableOnTarget(app.getName(), target.getTargetId(), app.getAppId()));
        assertTrue(fixture.apps.isNameAvailableOnTarget(app.getName(), otherTarget, null));
        assertTrue(fixture.apps.isTargetUsed(target.getTargetId()));
        assertFalse(fixture.apps.isTargetUsed(otherTarget));
        assertThat(fixture.apps.findByName(app.getName())).contains(app);
    }

    @Test
    @DisplayName("场景: 已删除的应用不再占用名称与目标")
    void shouldIgnoreDeletedApps() {
        TargetAggregate target = fixture.readyTarget();
        AppAggregate app = fixture.app(target.getTargetId());

        app.requestCleanup(fixture.context.getRequester());
        app.delete(true);
        fixture.apps.save(app);

        assertThat(fixture.apps.findByName(app.getName())).isEmpty();
        assertFalse(fixture.apps.isTargetUsed(target.getTargetId()));
        assertTrue(fixture.apps.findById(app.getAppId()).isPresent());
    }

    @Test
    @DisplayName("场景: 任一环境绑定都视为使用了目标")
    void shouldDetectUsageByAnyEnvironment() {
        TargetId production = TargetId.generate();
        TargetId staging = TargetId.generate();
        AppAggregate app = AppAggregate.create(DomainTestFactory.randomAppName(),
                fixture.available(DomainTestFactory.randomAppName(), EnvironmentConfig.of(production)),
                fixture.available(DomainTestFactory.randomAppName(), EnvironmentConfig.of(staging)),
                fixture.context.getRequester());

        fixture.apps.save(app);

        assertTrue(fixture.apps.isTargetUsed(production));
        assertTrue(fixture.apps.isTargetUsed(staging));
    }

    // ============================================
    // 部署
    // ============================================

    @Test
    @DisplayName("场景: 部署按编号排序，按应用与目标统计状态")
    void shouldQueryDeployments() {
        // Given
        TargetAggregate target = fixture.readyTarget();
        AppAggregate app = fixture.app(target.getTargetId());
        AppAggregate other = fixture.app(target.getTargetId());

        DeploymentAggregate first = app.newDeployment(DomainTestFactory.randomSource(), Environment.STAGING,
                fixture.context.getRequester());
        DeploymentAggregate second = app.newDeployment(DomainTestFactory.randomSource(), Environment.PRODUCTION,
                fixture.context.getRequester());
        fixture.deployments.save(second);
        fixture.deployments.save(first);

        // Then
        assertThat(fixture.deployments.findByApp(app.getAppId()))
                .extracting(DeploymentAggregate::getDeploymentId)
                .containsExactly(first.getDeploymentId(), second.getDeploymentId());
        assertThat(fixture.deployments.findByApp(AppId.generate())).isEmpty();
        assertTrue(fixture.deployments.hasRunningOrPendingDeployments(target.getTargetId()));
        assertTrue(fixture.deployments.hasRunningOrPendingDeployments(app.getAppId(), target.getTargetId()));
        assertFalse(fixture.deployments.hasRunningOrPendingDeployments(other.getAppId(), target.getTargetId()));

        // When
        for (DeploymentAggregate deployment : fixture.deployments.findByApp(app.getAppId())) {
            deployment.markAsRunning();
            deployment.markAsEnded(null);
            fixture.deployments.save(deployment);
        }

        // Then
        assertFalse(fixture.deployments.hasRunningOrPendingDeployments(target.getTargetId()));
        assertTrue(fixture.deployments.hasSucceededDeployment(app.getAppId(), target.getTargetId()));
        assertFalse(fixture.deployments.hasSucceededDeployment(other.getAppId(), target.getTargetId()));
    }
}
