package xyz.firestige.shipyard.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 领域事件发布器配置属性
 */
@ConfigurationProperties(prefix = "shipyard.event.publisher")
public class DomainEventPublisherProperties {

    /**
     * 发布器类型：spring（默认）, outbox, composite
     */
    private String type = "spring";

    /**
     * 复合模式配置
     */
    private CompositeProperties composite = new CompositeProperties();

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public CompositeProperties getComposite() {
        return composite;
    }

    public void setComposite(CompositeProperties composite) {
        this.composite = composite;
    }

    /**
     * 复合模式配置属性
     */
    public static class CompositeProperties {
        /**
         * 是否启用本地事件总线，默认：true
         */
        private boolean enableLocal = true;

        /**
         * 是否启用 outbox，默认：false
         */
        private boolean enableOutbox = false;

        /**
         * 是否快速失败（任一发布器失败立即抛异常），默认：false
         */
        private boolean failFast = false;

        public boolean isEnableLocal() {
            return enableLocal;
        }

        public void setEnableLocal(boolean enableLocal) {
            this.enableLocal = enableLocal;
        }

        public boolean isEnableOutbox() {
            return enableOutbox;
        }

        public void setEnableOutbox(boolean enableOutbox) {
            this.enableOutbox = enableOutbox;
        }

        public boolean isFailFast() {
            return failFast;
        }

        public void setFailFast(boolean failFast) {
            this.failFast = failFast;
        }
    }
}
