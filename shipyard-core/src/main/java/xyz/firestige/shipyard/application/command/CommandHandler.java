package xyz.firestige.shipyard.application.command;

/**
 * 命令处理器
 * <p>
 * 负责加载聚合、调用聚合行为、保存结果；领域异常原样向上抛出，由命令总线转换为失败结果
 *
 * @param <C> 命令类型
 * @param <R> 结果类型
 */
public interface CommandHandler<C extends Command<R>, R> {

    R handle(C command, RequestContext context);

    /**
     * 处理器负责的命令类型，用于命令总线注册
     */
    Class<C> commandType();
}
