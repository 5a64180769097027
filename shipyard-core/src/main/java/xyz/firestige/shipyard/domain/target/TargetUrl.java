package xyz.firestige.shipyard.domain.target;

import xyz.firestige.shipyard.domain.target.exception.InvalidUrlException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * 目标 URL 值对象
 * <p>
 * 只接受带主机名的 http/https 绝对地址，比较基于规范化后的字符串（小写 scheme/host，去掉末尾的 /）
 */
public final class TargetUrl {

    private final URI value;

    private TargetUrl(URI value) {
        this.value = value;
    }

    public static TargetUrl parse(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            throw new InvalidUrlException(raw);
        }
        URI uri;
        try {
            uri = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(raw);
        }
        String scheme = uri.getScheme();
        if (scheme == null || uri.getHost() == null) {
            throw new InvalidUrlException(raw);
        }
        scheme = scheme.toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new InvalidUrlException(raw);
        }
        String path = uri.getPath() == null ? "" : uri.getPath();
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        try {
            return new TargetUrl(new URI(scheme, null, uri.getHost().toLowerCase(Locale.ROOT),
                    uri.getPort(), path.isEmpty() ? null : path, null, null));
        } catch (URISyntaxException e) {
            throw new InvalidUrlException(raw);
        }
    }

    public String getScheme() {
        return value.getScheme();
    }

    public String getHost() {
        return value.getHost();
    }

    public boolean isSecure() {
        return "https".equals(value.getScheme());
    }

    public String getValue() {
        return value.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TargetUrl that = (TargetUrl) o;
        return Objects.equals(getValue(), that.getValue());
    }

    @Override
    public int hashCode() {
        return Objects.hash(getValue());
    }

    @Override
    public String toString() {
        return getValue();
    }
}
