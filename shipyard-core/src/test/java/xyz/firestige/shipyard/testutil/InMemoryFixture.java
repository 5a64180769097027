package xyz.firestige.shipyard.testutil;

import xyz.firestige.shipyard.application.command.RequestContext;
import xyz.firestige.shipyard.domain.app.AppAggregate;
import xyz.firestige.shipyard.domain.app.AppName;
import xyz.firestige.shipyard.domain.app.EnvironmentConfig;
import xyz.firestige.shipyard.domain.app.EnvironmentConfigRequirement;
import xyz.firestige.shipyard.domain.shared.vo.TargetId;
import xyz.firestige.shipyard.domain.target.TargetAggregate;
import xyz.firestige.shipyard.infrastructure.persistence.app.InMemoryAppRepository;
import xyz.firestige.shipyard.infrastructure.persistence.deployment.InMemoryDeploymentRepository;
import xyz.firestige.shipyard.infrastructure.persistence.target.InMemoryTargetRepository;
import xyz.firestige.shipyard.testutil.factory.DomainTestFactory;

/**
 * 处理器测试夹具：三个内存仓储共享一个记录型事件发布器
 */
public class InMemoryFixture {

    public final RecordingEventPublisher events = new RecordingEventPublisher();
    public final InMemoryTargetRepository targets = new InMemoryTargetRepository(events);
    public final InMemoryAppRepository apps = new InMemoryAppRepository(events);
    public final InMemoryDeploymentRepository deployments = new InMemoryDeploymentRepository(events);
    public final RequestContext context = RequestContext.of(DomainTestFactory.randomUser(), "test-correlation");

    /**
     * 保存一个已就绪的目标，并清空事件记录
     */
    public TargetAggregate readyTarget() {
        TargetAggregate target = DomainTestFactory.readyTarget();
        targets.save(target);
        events.clear();
        return target;
    }

    /**
     * 保存一个两个环境都绑定到指定目标的应用，并清空事件记录
     */
    public AppAggregate app(TargetId target) {
        AppAggregate app = DomainTestFactory.newApp(target);
        apps.save(app);
        events.clear();
        return app;
    }

    public EnvironmentConfigRequirement available(AppName name, EnvironmentConfig config) {
        return new EnvironmentConfigRequirement(config, true, true, name);
    }
}
