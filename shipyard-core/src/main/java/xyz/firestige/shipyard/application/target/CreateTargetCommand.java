package xyz.firestige.shipyard.application.target;

import xyz.firestige.shipyard.application.command.Command;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.ProviderConfig;

/**
 * 创建目标
 *
 * @param name 展示名称
 * @param url 目标对外暴露的根地址
 * @param provider Provider 配置
 */
public record CreateTargetCommand(String name, String url, ProviderConfig provider) implements Command<TargetId> {
}
