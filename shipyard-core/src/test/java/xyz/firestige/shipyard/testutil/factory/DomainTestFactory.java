package xyz.firestige.shipyard.testutil.factory;

import com.github.javafaker.Faker;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.app.EnvironmentConfigRequirement;
import xyz.firestige.shipyard.domain.deployment.SourceData;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.shared.vo.UserId;
import xyz.firestige.shipyard.domain.target.ProviderConfigRequirement;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.domain.target.TargetUrl;
import xyz.firestige.shipyard.domain.target.TargetUrlRequirement;
import xyz.firestige.shipyard.testutil.DummyProviderConfig;

import java.util.Locale;
import java.util.Map;

/**
 * 领域对象测试工厂
 * <p>
 * 用途：快速创建值对象与聚合，减少测试代码重复
 */
public final class DomainTestFactory {

    private static final Faker FAKER = new Faker();

    private DomainTestFactory() {
    }

    public static UserId randomUser() {
        return UserId.of(FAKER.name().username());
    }

    public static TargetUrl randomUrl() {
        return TargetUrl.parse("http://" + FAKER.letterify("target-??????").toLowerCase(Locale.ROOT)
                + FAKER.number().digits(4) + ".localhost");
    }

    public static DummyProviderConfig randomConfig() {
        return new DummyProviderConfig(FAKER.lorem().word(), "fp-" + FAKER.number().digits(8));
    }

    public static AppName randomAppName() {
        return AppName.parse("app-" + FAKER.number().digits(6));
    }

    public static SourceData randomSource() {
        return new SourceData("git", FAKER.internet().url() + "#" + FAKER.crypto().sha1());
    }

    public static Map<String, Map<String, String>> randomVars() {
        return Map.of("web", Map.of("LOG_LEVEL", FAKER.options().option("debug", "info", "warn")));
    }

    /**
     * 创建一个 URL 与配置均唯一的目标（CONFIGURING）
     */
    public static TargetAggregate newTarget() {
        return TargetAggregate.create(FAKER.app().name(),
                new TargetUrlRequirement(randomUrl(), true),
                new ProviderConfigRequirement(randomConfig(), true),
                randomUser());
    }

    /**
     * 创建一个已就绪且缓冲区已清空的目标
     */
    public static TargetAggregate readyTarget() {
        TargetAggregate target = newTarget();
        target.configured(target.getCurrentVersion(), null);
        target.clearDomainEvents();
        return target;
    }

    public static EnvironmentConfigRequirement availableEnvironment(AppName name, TargetId target) {
        return new EnvironmentConfigRequirement(EnvironmentConfig.of(target, randomVars()), true, true, name);
    }

    /**
     * 创建生产、预发都绑定到同一目标的应用（缓冲区已清空）
     */
    public static AppAggregate newApp(TargetId target) {
        AppName name = randomAppName();
        AppAggregate app = AppAggregate.create(name,
                availableEnvironment(name, target),
                availableEnvironment(name, target),
                randomUser());
        app.clearDomainEvents();
        return app;
    }
}
