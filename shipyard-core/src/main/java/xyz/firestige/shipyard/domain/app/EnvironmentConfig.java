package xyz.firestige.shipyard.domain.app;

import xyz.firestige.shipyard.domain.shared.vo.TargetId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 环境配置：绑定的目标 + 按服务划分的环境变量
 * <p>
 * 构造时深拷贝，之后不可变
 */
public final class EnvironmentConfig {

    private final TargetId target;
    private final Map<String, Map<String, String>> vars;

    private EnvironmentConfig(TargetId target, Map<String, Map<String, String>> vars) {
        this.target = Objects.requireNonNull(target, "target cannot be null");
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (vars != null) {
            vars.forEach((service, values) ->
                    copy.put(service, values == null
                            ? Collections.emptyMap()
                            : Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        }
        this.vars = Collections.unmodifiableMap(copy);
    }

    public static EnvironmentConfig of(TargetId target) {
        return new EnvironmentConfig(target, null);
    }

    public static EnvironmentConfig of(TargetId target, Map<String, Map<String, String>> vars) {
        return new EnvironmentConfig(target, vars);
    }

    public TargetId getTarget() {
        return target;
    }

    /**
     * 服务名 → (变量名 → 值)
     */
    public Map<String, Map<String, String>> getVars() {
        return vars;
    }

    public EnvironmentConfig withVars(Map<String, Map<String, String>> newVars) {
        return new EnvironmentConfig(target, newVars);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        EnvironmentConfig that = (EnvironmentConfig) o;
        return target.equals(that.target) && vars.equals(that.vars);
    }

    @Override
    public int hashCode() {
        return Objects.hash(target, vars);
    }

    @Override
    public String toString() {
        return "EnvironmentConfig{target=" + target + ", services=" + vars.keySet() + '}';
    }
}
