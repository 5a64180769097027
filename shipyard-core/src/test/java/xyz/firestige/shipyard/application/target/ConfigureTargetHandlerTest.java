package xyz.firestige.shipyard.application.target;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetProvider;
import xyz.firestige.shipyard.domain.target.TargetStatus;
import xyz.firestige.shipyard.domain.target.event.TargetStateChangedEvent;
import xyz.firestige.shipyard.domain.target.exception.ProviderException;
import xyz.firestige.shipyard.domain.target.exception.TargetConfigurationInProgressException;
import xyz.firestige.shipyard.testutil.InMemoryFixture;
import xyz.firestige.shipyard.testutil.TimingExtension;
import xyz.firestige.shipyard.testutil.factory.DomainTestFactory;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * 目标配置用例测试（Provider 使用 Mockito 模拟）
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("ConfigureTargetHandler 测试")
class ConfigureTargetHandlerTest {

    private InMemoryFixture fixture;
    private TargetProvider provider;
    private ConfigureTargetHandler handler;
    private TargetAggregate target;

    @BeforeEach
    void setUp() {
        fixture = new InMemoryFixture();
        provider = mock(TargetProvider.class);
        handler = new ConfigureTargetHandler(fixture.targets, provider);

        target = DomainTestFactory.newTarget();
        fixture.targets.save(target);
        fixture.events.clear();
    }

    @Test
    @DisplayName("场景: Provider 配置成功，目标就绪")
    void shouldMarkReady() {
        // When
        handler.handle(new ConfigureTargetCommand(target.getTargetId(), target.getCurrentVersion()), fixture.context);

        // Then
        verify(provider).setup(target);
        assertEquals(TargetStatus.READY, target.getState().getStatus());
        TargetStateChangedEvent event = fixture.events.getLastEvent(TargetStateChangedEvent.class);
        assertEquals(TargetStatus.READY, event.getState().getStatus());
    }

    @Test
    @DisplayName("场景: Provider 失败时目标标记为失败，命令本身不失败")
    void shouldMarkFailedOnProviderError() {
        // Given
        doThrow(new ProviderException("docker daemon unreachable")).when(provider).setup(any());

        // When
        handler.handle(new ConfigureTargetCommand(target.getTargetId(), target.getCurrentVersion()), fixture.context);

        // Then
        assertEquals(TargetStatus.FAILED, target.getState().getStatus());
        assertThat(target.getState().getErrorCode()).contains("docker daemon unreachable");
    }

    @Test
    @DisplayName("场景: 过期版本的配置请求直接跳过")
    void shouldSkipOutdatedVersion() {
        Instant stale = target.getCurrentVersion().minusSeconds(30);

        handler.handle(new ConfigureTargetCommand(target.getTargetId(), stale), fixture.context);

        verify(provider, never()).setup(any());
        assertEquals(TargetStatus.CONFIGURING, target.getState().getStatus());
        assertEquals(0, fixture.events.getEventCount());
    }

    @Test
    @DisplayName("场景: 重新配置后旧版本回报被忽略")
    void shouldIgnoreReportOfPreviousVersion() {
        // Given
        handler.handle(new ConfigureTargetCommand(target.getTargetId(), target.getCurrentVersion()), fixture.context);
        Instant firstVersion = target.getCurrentVersion();
        ReconfigureTargetHandler reconfigure = new ReconfigureTargetHandler(fixture.targets);
        reconfigure.handle(new ReconfigureTargetCommand(target.getTargetId()), fixture.context);

        // When
        handler.handle(new ConfigureTargetCommand(target.getTargetId(), firstVersion), fixture.context);

        // Then
        assertEquals(TargetStatus.CONFIGURING, target.getState().getStatus());
        assertThrows(TargetConfigurationInProgressException.class,
                () -> reconfigure.handle(new ReconfigureTargetCommand(target.getTargetId()), fixture.context));
    }
}
