package xyz.firestige.shipyard.infrastructure.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.application.command.CommandBus;
import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.command.CommandResult;
import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.shared.exception.DomainException;
import xyz.firestige.shipyard.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.shipyard.infrastructure.metrics.NoopMetricsRegistry;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 同步命令总线
 * <p>
 * 职责：
 * 1. 按命令类型分发到已注册的处理器
 * 2. 执行期间在 MDC 中放入 command / requester / correlationId，结束后恢复原值
 * 3. 将 {@link DomainException} 转换为失败结果，其他异常原样抛出
 * 4. 记录命令耗时，超过阈值的命令以 warn 级别输出
 */
public class SimpleCommandBus implements CommandBus {

    private static final Logger logger = LoggerFactory.getLogger(SimpleCommandBus.class);

    static final String MDC_COMMAND = "command";
    static final String MDC_REQUESTER = "requester";
    static final String MDC_CORRELATION_ID = "correlationId";

    static final String METRIC_SUCCEEDED = "shipyard.command.succeeded";
    static final String METRIC_FAILED = "shipyard.command.failed";
    static final String METRIC_DURATION = "shipyard.command.duration";

    private final Map<Class<?>, CommandHandler<?, ?>> handlers = new ConcurrentHashMap<>();
    private final MetricsRegistry metrics;
    private final Duration slowThreshold;

    public SimpleCommandBus() {
        this(new NoopMetricsRegistry(), Duration.ofSeconds(5));
    }

    public SimpleCommandBus(MetricsRegistry metrics, Duration slowThreshold) {
        this.metrics = metrics;
        this.slowThreshold = slowThreshold;
    }

    @Override
    public void register(CommandHandler<?, ?> handler) {
        CommandHandler<?, ?> previous = handlers.putIfAbsent(handler.commandType(), handler);
        if (previous != null) {
            throw new IllegalStateException("命令已注册处理器: " + handler.commandType().getName()
                    + " -> " + previous.getClass().getName());
        }
        logger.debug("[SimpleCommandBus] 注册处理器: {} -> {}",
                handler.commandType().getSimpleName(), handler.getClass().getSimpleName());
    }

    @Override
    @SuppressWarnings("unchecked")
    public <R> CommandResult<R> execute(Command<R> command, RequestContext context) {
        CommandHandler<Command<R>, R> handler = (CommandHandler<Command<R>, R>) handlers.get(command.getClass());
        if (handler == null) {
            throw new IllegalStateException("没有处理器注册到命令: " + command.getClass().getName());
        }

        String commandName = command.getCommandName();
        // 处理器内可能再次分发命令，结束时恢复外层的 MDC
        String outerCommand = MDC.get(MDC_COMMAND);
        String outerRequester = MDC.get(MDC_REQUESTER);
        String outerCorrelationId = MDC.get(MDC_CORRELATION_ID);
        MDC.put(MDC_COMMAND, commandName);
        MDC.put(MDC_REQUESTER, context.getRequester().getValue());
        MDC.put(MDC_CORRELATION_ID, context.getCorrelationId());
        long start = System.nanoTime();
        try {
            R value = handler.handle(command, context);
            metrics.incrementCounter(METRIC_SUCCEEDED, "command", commandName);
            return CommandResult.success(value);
        } catch (DomainException e) {
            logger.warn("[SimpleCommandBus] 命令被拒绝: {}, errorCode: {}, 原因: {}",
                    commandName, e.getErrorCode(), e.getMessage());
            metrics.incrementCounter(METRIC_FAILED, "command", commandName, "errorCode", e.getErrorCode());
            return CommandResult.failure(e.toFailureInfo());
        } finally {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordTimer(METRIC_DURATION, elapsed, "command", commandName);
            if (elapsed.compareTo(slowThreshold) > 0) {
                logger.warn("[SimpleCommandBus] 慢命令: {}, 耗时: {}ms", commandName, elapsed.toMillis());
            }
            restoreMdc(MDC_COMMAND, outerCommand);
            restoreMdc(MDC_REQUESTER, outerRequester);
            restoreMdc(MDC_CORRELATION_ID, outerCorrelationId);
        }
    }

    private static void restoreMdc(String key, String previous) {
        if (previous == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, previous);
        }
    }

    public int getHandlerCount() {
        return handlers.size();
    }
}
