package xyz.firestige.shipyard.application.command;

/**
 * 命令总线
 * <p>
 * 所有被拒绝的命令都以失败结果返回，领域异常不会越过总线
 */
public interface CommandBus {

    <R> CommandResult<R> execute(Command<R> command, RequestContext context);

    void register(CommandHandler<?, ?> handler);
}
