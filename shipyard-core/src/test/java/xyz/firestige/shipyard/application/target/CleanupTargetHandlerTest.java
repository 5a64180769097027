package xyz.firestige.shipyard.application.target;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.shipyard.domain.app.Environment;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.deployment.DeploymentAggregate;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.CleanupStrategy;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetProvider;
import xyz.firestige.shipyard.domain.target.event.TargetCleanupRequestedEvent;
import xyz.firestige.shipyard.domain.target.event.TargetDeletedEvent;
import xyz.firestige.shipyard.domain.target.exception.RunningOrPendingDeploymentsException;
import xyz.firestige.shipyard.domain.target.exception.TargetCleanupNeededException;
import xyz.firestige.shipyard.domain.target.exception.TargetInUseException;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;
import xyz.firestige.shipyard.testutil.InMemoryFixture;
import xyz.firestige.shipyard.testutil.TimingExtension;
import xyz.firestige.shipyard.testutil.factory.DomainTestFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 目标清理用例测试
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("目标清理用例测试")
class CleanupTargetHandlerTest {

    private InMemoryFixture fixture;
    private TargetProvider provider;
    private RequestTargetCleanupHandler requestHandler;
    private CleanupTargetHandler cleanupHandler;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryFixture();
        provider = mock(TargetProvider.class);
        requestHandler = new RequestTargetCleanupHandler(fixture.targets, fixture.apps);
        cleanupHandler = new CleanupTargetHandler(fixture.targets, fixture.deployments, provider);
    }

    @Test
    @DisplayName("场景: 仍被应用使用的目标不能请求清理")
    void shouldRejectRequestWhenUsed() {
        TargetAggregate target = fixture.readyTarget();
        fixture.app(target.getTargetId());

        assertThrows(TargetInUseException.class, () -> requestHandler.handle(
                new RequestTargetCleanupCommand(target.getTargetId()), fixture.context));
        assertFalse(target.isCleanupRequested());
    }

    @Test
    @DisplayName("场景: 未请求清理时不调用 Provider")
    void shouldRequireCleanupRequest() {
        TargetAggregate target = fixture.readyTarget();

        assertThrows(TargetCleanupNeededException.class, () -> cleanupHandler.handle(
                new CleanupTargetCommand(target.getTargetId()), fixture.context));
        verify(provider, never()).cleanupTarget(any(), any());
    }

    @Test
    @DisplayName("场景: 请求清理后回收资源并删除目标")
    void shouldCleanupAndDelete() {
        // Given
        TargetAggregate target = fixture.readyTarget();
        requestHandler.handle(new RequestTargetCleanupCommand(target.getTargetId()), fixture.context);

        // When
        cleanupHandler.handle(new CleanupTargetCommand(target.getTargetId()), fixture.context);

        // Then
        verify(provider).cleanupTarget(target, CleanupStrategy.DEFAULT);
        assertTrue(target.isDeleted());
        assertThat(fixture.events.getEventsOfType(TargetCleanupRequestedEvent.class)).hasSize(1);
        assertThat(fixture.events.getEventsOfType(TargetDeletedEvent.class)).hasSize(1);
        assertFalse(fixture.targets.exists(target.getTargetId()));
    }

    @Test
    @DisplayName("场景: 目标上仍有排队中的部署")
    void shouldRejectWithPendingDeployments() {
        // Given
        TargetAggregate target = fixture.readyTarget();
        AppAggregate app = fixture.app(target.getTargetId());
        DeploymentAggregate pending = app.newDeployment(DomainTestFactory.randomSource(), Environment.STAGING,
                fixture.context.getRequester());
        fixture.deployments.save(pending);
        target.requestCleanup(false, fixture.context.getRequester());
        fixture.targets.save(target);

        // When / Then
        assertThrows(RunningOrPendingDeploymentsException.class, () -> cleanupHandler.handle(
                new CleanupTargetCommand(target.getTargetId()), fixture.context));
        verify(provider, never()).cleanupTarget(any(), any());
        assertFalse(target.isDeleted());
    }

    @Test
    @DisplayName("场景: 清理不存在的目标")
    void shouldRejectUnknownTarget() {
        assertThrows(TargetNotFoundException.class, () -> cleanupHandler.handle(
                new CleanupTargetCommand(TargetId.generate()), fixture.context));
    }
}
