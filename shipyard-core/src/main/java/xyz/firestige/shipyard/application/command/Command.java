package xyz.firestige.shipyard.application.command;

/**
 * 命令标记接口
 *
 * @param <R> 命令成功时的结果类型，无结果时为 {@link Void}
 */
public interface Command<R> {

    default String getCommandName() {
        return getClass().getSimpleName();
    }
}
