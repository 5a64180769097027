package xyz.firestige.shipyard.infrastructure.bus;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.slf4j.MDC;
import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.CommandResult;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.shared.exception.ErrorType;
import xyz.firestige.shipyard.domain.shared.exception.FailureInfo;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.exception.TargetNotFoundException;
import xyz.firestige.shipyard.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.shipyard.testutil.TimingExtension;
import xyz.firestige.shipyard.testutil.factory.DomainTestFactory;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * SimpleCommandBus 单元测试
 */
@Tag("unit")
@Tag("fast")
@ExtendWith(TimingExtension.class)
@DisplayName("SimpleCommandBus 单元测试")
class SimpleCommandBusTest {

    record EchoCommand(String text) implements Command<String> {
    }

    record LookupCommand(TargetId targetId) implements Command<Void> {
    }

    record CrashCommand() implements Command<Void> {
    }

    record RelayCommand(String text) implements Command<String> {
    }

    /**
     * 回显命令，同时记录执行期间的 MDC
     */
    static class EchoHandler implements CommandHandler<EchoCommand, String> {
        final Map<String, String> observedMdc = new HashMap<>();

        @Override
        public String handle(EchoCommand command, RequestContext context) {
            observedMdc.putAll(MDC.getCopyOfContextMap());
            return command.text();
        }

        @Override
        public Class<EchoCommand> commandType() {
            return EchoCommand.class;
        }
    }

    static class LookupHandler implements CommandHandler<LookupCommand, Void> {
        @Override
        public Void handle(LookupCommand command, RequestContext context) {
            throw new TargetNotFoundException(command.targetId());
        }

        @Override
        public Class<LookupCommand> commandType() {
            return LookupCommand.class;
        }
    }

    static class CrashHandler implements CommandHandler<CrashCommand, Void> {
        @Override
        public Void handle(CrashCommand command, RequestContext context) {
            throw new IllegalStateException("boom");
        }

        @Override
        public Class<CrashCommand> commandType() {
            return CrashCommand.class;
        }
    }

    /**
     * 在处理过程中再次经总线分发 EchoCommand，记录内层返回后的 MDC
     */
    static class RelayHandler implements CommandHandler<RelayCommand, String> {
        final SimpleCommandBus bus;
        final Map<String, String> mdcAfterInner = new HashMap<>();

        RelayHandler(SimpleCommandBus bus) {
            this.bus = bus;
        }

        @Override
        public String handle(RelayCommand command, RequestContext context) {
            RequestContext inner = RequestContext.of(context.getRequester(), "corr-inner");
            String value = bus.execute(new EchoCommand(command.text()), inner).getValue();
            mdcAfterInner.putAll(MDC.getCopyOfContextMap());
            return value;
        }

        @Override
        public Class<RelayCommand> commandType() {
            return RelayCommand.class;
        }
    }

    private SimpleMeterRegistry meterRegistry;
    private SimpleCommandBus bus;
    private EchoHandler echoHandler;
    private RequestContext context;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        bus = new SimpleCommandBus(new MicrometerMetricsRegistry(meterRegistry), Duration.ofSeconds(5));
        echoHandler = new EchoHandler();
        bus.register(echoHandler);
        bus.register(new LookupHandler());
        bus.register(new CrashHandler());
        context = RequestContext.of(DomainTestFactory.randomUser(), "corr-1");
    }

    @Test
    @DisplayName("场景: 分发到已注册的处理器并返回结果")
    void shouldDispatchToHandler() {
        // When
        CommandResult<String> result = bus.execute(new EchoCommand("hello"), context);

        // Then
        assertTrue(result.isSuccess());
        assertEquals("hello", result.getValue());
        assertNull(result.getErrorCode());
        assertThat(result.getFailureInfo()).isEmpty();
        assertEquals(1.0, meterRegistry.counter(SimpleCommandBus.METRIC_SUCCEEDED, "command", "EchoCommand").count());
        assertEquals(1L, meterRegistry.timer(SimpleCommandBus.METRIC_DURATION, "command", "EchoCommand").count());
    }

    @Test
    @DisplayName("场景: 领域异常转换为失败结果")
    void shouldConvertDomainExceptionToFailure() {
        // Given
        TargetId missing = TargetId.generate();

        // When
        CommandResult<Void> result = bus.execute(new LookupCommand(missing), context);

        // Then
        assertFalse(result.isSuccess());
        assertEquals(TargetNotFoundException.ERROR_CODE, result.getErrorCode());
        FailureInfo failure = result.getFailureInfo().orElseThrow();
        assertEquals(ErrorType.NOT_FOUND, failure.getErrorType());
        assertEquals(missing.getValue(), failure.getContext().get("targetId"));
        assertThrows(IllegalStateException.class, result::getValue);
        assertEquals(1.0, meterRegistry.counter(SimpleCommandBus.METRIC_FAILED,
                "command", "LookupCommand", "errorCode", TargetNotFoundException.ERROR_CODE).count());
    }

    @Test
    @DisplayName("场景: 非领域异常原样抛出")
    void shouldPropagateUnexpectedException() {
        assertThatThrownBy(() -> bus.execute(new CrashCommand(), context))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
        assertEquals(1L, meterRegistry.timer(SimpleCommandBus.METRIC_DURATION, "command", "CrashCommand").count());
    }

    @Test
    @DisplayName("场景: 执行期间 MDC 带有命令上下文，结束后清理")
    void shouldPopulateAndClearMdc() {
        bus.execute(new EchoCommand("mdc"), context);

        assertEquals("EchoCommand", echoHandler.observedMdc.get(SimpleCommandBus.MDC_COMMAND));
        assertEquals(context.getRequester().getValue(), echoHandler.observedMdc.get(SimpleCommandBus.MDC_REQUESTER));
        assertEquals("corr-1", echoHandler.observedMdc.get(SimpleCommandBus.MDC_CORRELATION_ID));
        assertTrue(MDC.getCopyOfContextMap() == null || MDC.getCopyOfContextMap().isEmpty(),
                "MDC should be cleared after execution");
    }

    @Test
    @DisplayName("场景: 嵌套分发命令后恢复外层命令的 MDC")
    void shouldRestoreOuterMdcAfterNestedCommand() {
        // Given
        RelayHandler relayHandler = new RelayHandler(bus);
        bus.register(relayHandler);

        // When
        CommandResult<String> result = bus.execute(new RelayCommand("nested"), context);

        // Then
        assertEquals("nested", result.getValue());
        assertEquals("EchoCommand", echoHandler.observedMdc.get(SimpleCommandBus.MDC_COMMAND));
        assertEquals("corr-inner", echoHandler.observedMdc.get(SimpleCommandBus.MDC_CORRELATION_ID));
        assertEquals("RelayCommand", relayHandler.mdcAfterInner.get(SimpleCommandBus.MDC_COMMAND));
        assertEquals("corr-1", relayHandler.mdcAfterInner.get(SimpleCommandBus.MDC_CORRELATION_ID));
        assertEquals(context.getRequester().getValue(), relayHandler.mdcAfterInner.get(SimpleCommandBus.MDC_REQUESTER));
        assertNull(MDC.get(SimpleCommandBus.MDC_COMMAND));
    }

    @Test
    @DisplayName("场景: 未注册的命令")
    void shouldRejectUnregisteredCommand() {
        SimpleCommandBus empty = new SimpleCommandBus();

        assertThrows(IllegalStateException.class, () -> empty.execute(new EchoCommand("x"), context));
        assertEquals(0, empty.getHandlerCount());
    }

    @Test
    @DisplayName("场景: 同一命令重复注册处理器")
    void shouldRejectDuplicateRegistration() {
        assertThrows(IllegalStateException.class, () -> bus.register(new EchoHandler()));
        assertEquals(3, bus.getHandlerCount());
    }
}
