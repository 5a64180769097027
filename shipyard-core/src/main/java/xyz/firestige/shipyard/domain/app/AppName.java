package xyz.firestige.shipyard.domain.app;

import xyz.firestige.shipyard.domain.app.exception.InvalidAppNameException;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 应用名称值对象
 * <p>
 * 会被用作容器、子域名等资源的前缀，因此只接受类似 DNS label 的格式
 */
public final class AppName {

    private static final Pattern FORMAT = Pattern.compile("^[a-z]([a-z0-9-]*[a-z0-9])?$");

    private final String value;

    private AppName(String value) {
        this.value = value;
    }

    public static AppName parse(String raw) {
        if (raw == null || !FORMAT.matcher(raw).matches()) {
            throw new InvalidAppNameException(raw);
        }
        return new AppName(raw);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AppName appName = (AppName) o;
        return Objects.equals(value, appName.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
