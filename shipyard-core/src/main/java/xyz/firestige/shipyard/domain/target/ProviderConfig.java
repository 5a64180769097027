package xyz.firestige.shipyard.domain.target;

/**
 * Provider 配置
 * <p>
 * 对核心是不透明的，核心只关心：
 * 1. kind：具体 Provider 的类型（docker 等）
 * 2. fingerprint：配置所指向的基础设施标识，同一指纹不能被两个目标同时占用，且一经设定不可变更
 * 3. equals：值相等语义，相等的配置视为未变更
 */
public interface ProviderConfig {

    String kind();

    String fingerprint();
}
