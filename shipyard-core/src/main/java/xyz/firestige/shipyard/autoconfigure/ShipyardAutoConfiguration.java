package xyz.firestige.shipyard.autoconfigure;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import xyz.firestige.shipyard.application.app.CleanupAppHandler;
import xyz.firestige.shipyard.application.app.CreateAppHandler;
import xyz.firestige.shipyard.application.app.RequestAppCleanupHandler;
import xyz.firestige.shipyard.application.app.UpdateAppEnvironmentHandler;
import xyz.firestige.shipyard.application.command.CommandBus;
import xyz.firestige.shipyard.application.command.CommandHandler;
import xyz.firestige.shipyard.application.deployment.FinishDeploymentHandler;
import xyz.firestige.shipyard.application.deployment.PromoteHandler;
import xyz.firestige.shipyard.application.deployment.QueueDeploymentHandler;
import xyz.firestige.shipyard.application.deployment.RedeployHandler;
import xyz.firestige.shipyard.application.deployment.StartDeploymentHandler;
import xyz.firestige.shipyard.application.target.CleanupTargetHandler;
import xyz.firestige.shipyard.application.target.ConfigureTargetHandler;
import xyz.firestige.shipyard.application.target.CreateTargetHandler;
import xyz.firestige.shipyard.application.target.ReconfigureTargetHandler;
import xyz.firestige.shipyard.application.target.RequestTargetCleanupHandler;
import xyz.firestige.shipyard.application.target.UpdateTargetHandler;
import xyz.firestige.shipyard.config.properties.ShipyardCommandProperties;
import xyz.firestige.shipyard.config.properties.ShipyardPersistenceProperties;
import xyz.firestige.shipyard.domain.app.AppRepository;
import xyz.firestige.shipyard.domain.app.AppsReader;
import xyz.firestige.shipyard.domain.deployment.DeploymentRepository;
import xyz.firestige.shipyard.domain.deployment.DeploymentsReader;
import xyz.firestige.shipyard.domain.shared.event.DomainEventPublisher;
import xyz.firestige.shipyard.domain.target.TargetProvider;
import xyz.firestige.shipyard.domain.target.TargetRepository;
import xyz.firestige.shipyard.domain.target.TargetsReader;
import xyz.firestige.shipyard.infrastructure.bus.SimpleCommandBus;
import xyz.firestige.shipyard.infrastructure.metrics.MetricsRegistry;
import xyz.firestige.shipyard.infrastructure.metrics.MicrometerMetricsRegistry;
import xyz.firestige.shipyard.infrastructure.metrics.NoopMetricsRegistry;
import xyz.firestige.shipyard.infrastructure.persistence.app.InMemoryAppRepository;
import xyz.firestige.shipyard.infrastructure.persistence.deployment.InMemoryDeploymentRepository;
import xyz.firestige.shipyard.infrastructure.persistence.target.InMemoryTargetRepository;

/**
 * Shipyard 核心自动装配
 * <p>
 * 装配内容：
 * 1. 内存仓储（同时作为查询端），shipyard.persistence.store-type=memory
 * 2. 命令处理器；依赖 {@link TargetProvider} 的处理器仅在宿主提供 Provider 时注册
 * 3. 命令总线与指标
 * <p>
 * 所有 Bean 均可由宿主应用以同类型 Bean 替换
 */
@AutoConfiguration(after = DomainEventPublisherAutoConfiguration.class)
@EnableConfigurationProperties({ShipyardCommandProperties.class, ShipyardPersistenceProperties.class})
public class ShipyardAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ShipyardAutoConfiguration.class);

    // ========== 仓储 ==========

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = "shipyard.persistence.store-type", havingValue = "memory", matchIfMissing = true)
    static class InMemoryPersistenceConfiguration {

        @Bean
        @ConditionalOnMissingBean(TargetRepository.class)
        public InMemoryTargetRepository targetRepository(DomainEventPublisher eventPublisher) {
            log.info("[Shipyard] Using InMemoryTargetRepository");
            return new InMemoryTargetRepository(eventPublisher);
        }

        @Bean
        @ConditionalOnMissingBean(AppRepository.class)
        public InMemoryAppRepository appRepository(DomainEventPublisher eventPublisher) {
            log.info("[Shipyard] Using InMemoryAppRepository");
            return new InMemoryAppRepository(eventPublisher);
        }

        @Bean
        @ConditionalOnMissingBean(DeploymentRepository.class)
        public InMemoryDeploymentRepository deploymentRepository(DomainEventPublisher eventPublisher) {
            log.info("[Shipyard] Using InMemoryDeploymentRepository");
            return new InMemoryDeploymentRepository(eventPublisher);
        }
    }

    // ========== 指标 & 命令总线 ==========

    @Bean
    @ConditionalOnMissingBean
    public MetricsRegistry shipyardMetricsRegistry(ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        if (registry == null) {
            log.info("[Shipyard] MeterRegistry not found, metrics disabled");
            return new NoopMetricsRegistry();
        }
        return new MicrometerMetricsRegistry(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandBus commandBus(MetricsRegistry metricsRegistry,
                                 ShipyardCommandProperties properties,
                                 ObjectProvider<CommandHandler<?, ?>> handlers) {
        SimpleCommandBus bus = new SimpleCommandBus(metricsRegistry, properties.getSlowThreshold());
        handlers.orderedStream().forEach(bus::register);
        log.info("[Shipyard] CommandBus ready, handlers: {}", bus.getHandlerCount());
        return bus;
    }

    // ========== 目标 ==========

    @Bean
    @ConditionalOnMissingBean
    public CreateTargetHandler createTargetHandler(TargetRepository targetRepository, TargetsReader targetsReader) {
        return new CreateTargetHandler(targetRepository, targetsReader);
    }

    @Bean
    @ConditionalOnMissingBean
    public UpdateTargetHandler updateTargetHandler(TargetRepository targetRepository, TargetsReader targetsReader) {
        return new UpdateTargetHandler(targetRepository, targetsReader);
    }

    @Bean
    @ConditionalOnMissingBean
    public ReconfigureTargetHandler reconfigureTargetHandler(TargetRepository targetRepository) {
        return new ReconfigureTargetHandler(targetRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestTargetCleanupHandler requestTargetCleanupHandler(TargetRepository targetRepository, AppsReader appsReader) {
        return new RequestTargetCleanupHandler(targetRepository, appsReader);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TargetProvider.class)
    public ConfigureTargetHandler configureTargetHandler(TargetRepository targetRepository, TargetProvider targetProvider) {
        return new ConfigureTargetHandler(targetRepository, targetProvider);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TargetProvider.class)
    public CleanupTargetHandler cleanupTargetHandler(TargetRepository targetRepository,
                                                     DeploymentsReader deploymentsReader,
                                                     TargetProvider targetProvider) {
        return new CleanupTargetHandler(targetRepository, deploymentsReader, targetProvider);
    }

    // ========== 应用 ==========

    @Bean
    @ConditionalOnMissingBean
    public CreateAppHandler createAppHandler(AppRepository appRepository, AppsReader appsReader, TargetsReader targetsReader) {
        return new CreateAppHandler(appRepository, appsReader, targetsReader);
    }

    @Bean
    @ConditionalOnMissingBean
    public UpdateAppEnvironmentHandler updateAppEnvironmentHandler(AppRepository appRepository,
                                                                   AppsReader appsReader,
                                                                   TargetsReader targetsReader) {
        return new UpdateAppEnvironmentHandler(appRepository, appsReader, targetsReader);
    }

    @Bean
    @ConditionalOnMissingBean
    public RequestAppCleanupHandler requestAppCleanupHandler(AppRepository appRepository) {
        return new RequestAppCleanupHandler(appRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(TargetProvider.class)
    public CleanupAppHandler cleanupAppHandler(AppRepository appRepository,
                                               TargetRepository targetRepository,
                                               DeploymentsReader deploymentsReader,
                                               TargetProvider targetProvider) {
        return new CleanupAppHandler(appRepository, targetRepository, deploymentsReader, targetProvider);
    }

    // ========== 部署 ==========

    @Bean
    @ConditionalOnMissingBean
    public QueueDeploymentHandler queueDeploymentHandler(AppRepository appRepository, DeploymentRepository deploymentRepository) {
        return new QueueDeploymentHandler(appRepository, deploymentRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public PromoteHandler promoteHandler(AppRepository appRepository, DeploymentRepository deploymentRepository) {
        return new PromoteHandler(appRepository, deploymentRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public RedeployHandler redeployHandler(AppRepository appRepository, DeploymentRepository deploymentRepository) {
        return new RedeployHandler(appRepository, deploymentRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public StartDeploymentHandler startDeploymentHandler(DeploymentRepository deploymentRepository,
                                                         TargetRepository targetRepository) {
        return new StartDeploymentHandler(deploymentRepository, targetRepository);
    }

    @Bean
    @ConditionalOnMissingBean
    public FinishDeploymentHandler finishDeploymentHandler(DeploymentRepository deploymentRepository) {
        return new FinishDeploymentHandler(deploymentRepository);
    }
}
