package xyz.firestige.shipyard.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 持久化配置属性
 * <p>
 * 目前只内置内存存储；持久化实现由宿主应用以同类型 Bean 提供
 */
@ConfigurationProperties(prefix = "shipyard.persistence")
public class ShipyardPersistenceProperties {

    /**
     * 存储类型
     */
    private StoreType storeType = StoreType.memory;

    public enum StoreType {
        /**
         * 内存存储（测试与单实例，重启后丢失）
         */
        memory
    }

    public StoreType getStoreType() {
        return storeType;
    }

    public void setStoreType(StoreType storeType) {
        this.storeType = storeType;
    }
}
