package xyz.firestige.shipyard.testutil;

import xyz.firestige.shipyard.domain.target.ProviderConfig;

/**
 * 测试用 Provider 配置：data 决定相等性，fingerprint 决定唯一性
 */
public record DummyProviderConfig(String data, String fingerprint) implements ProviderConfig {

    public DummyProviderConfig(String data) {
        this(data, "");
    }

    @Override
    public String kind() {
        return "dummy";
    }
}
