package id.go.kemenkeu.djpbn.sakti.zk.starter.config;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.connection.CoordinationClientFactory;
import id.go.kemenkeu.djpbn.sakti.zk.core.connection.CoordinationSettings;
import id.go.kemenkeu.djpbn.sakti.zk.core.connection.CuratorCoordinationClient;
import id.go.kemenkeu.djpbn.sakti.zk.core.connection.InMemoryCoordinationClient;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.DistributedLock;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockRegistry;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.ZookeeperLockManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.metrics.LockMetrics;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationExecutor;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationGuard;
import id.go.kemenkeu.djpbn.sakti.zk.starter.aspect.ZkLockedAspect;
import id.go.kemenkeu.djpbn.sakti.zk.starter.filter.ConnectionScopeFilter;
import id.go.kemenkeu.djpbn.sakti.zk.starter.health.ZookeeperHealthIndicator;
import id.go.kemenkeu.djpbn.sakti.zk.starter.metrics.SaktiZkMicrometerMetrics;
import id.go.kemenkeu.djpbn.sakti.zk.starter.migration.MigrationGuardRunner;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(SaktiZkProperties.class)
public class SaktiZkAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SaktiZkAutoConfiguration.class);
    private final SaktiZkProperties properties;

    public SaktiZkAutoConfiguration(SaktiZkProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void validateConfiguration() {
        log.info("═══════════════════════════════════════════════════════════");
        log.info("SAKTI ZooKeeper Locks - Initializing...");
        log.info("═══════════════════════════════════════════════════════════");

        if (properties.getClientMode() == SaktiZkProperties.ClientMode.IN_MEMORY) {
            log.warn("⚠ In-memory coordination client - locks are NOT shared between JVMs");
        } else if (properties.getHosts().isEmpty()) {
            log.warn("⚠ sakti.zk.hosts is empty - lock acquisition will fail, migrations run unguarded");
        } else {
            log.info("ZooKeeper hosts: {} (namespace: {})",
                String.join(",", properties.getHosts()), properties.getNamespace());
        }

        logFeatureStatus("Distributed Lock", properties.getLock().isEnabled());
        logFeatureStatus("Request Connection Scope", properties.getWeb().isEnabled());
        logFeatureStatus("Migration Guard", properties.getMigration().isEnabled());
        logFeatureStatus("Health Indicator", properties.getHealth().isEnabled());
        log.info("═══════════════════════════════════════════════════════════");
    }

    private void logFeatureStatus(String feature, boolean enabled) {
        log.info("{}: {}", feature, enabled ? "✓ ENABLED" : "○ DISABLED");
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // CORE BEANS
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean
    @ConditionalOnMissingBean
    public LockMetrics lockMetrics() {
        return new LockMetrics();
    }

    @Bean
    @ConditionalOnMissingBean
    public CoordinationClientFactory coordinationClientFactory() {
        if (properties.getClientMode() == SaktiZkProperties.ClientMode.IN_MEMORY) {
            log.info("✓ In-memory CoordinationClientFactory created");
            return InMemoryCoordinationClient::new;
        }
        CoordinationSettings settings = properties.toSettings();
        log.info("✓ Curator CoordinationClientFactory created");
        return () -> new CuratorCoordinationClient(settings);
    }

    @Bean
    @ConditionalOnMissingBean
    public ConnectionManager connectionManager(CoordinationClientFactory coordinationClientFactory,
                                               LockMetrics lockMetrics) {
        log.info("✓ ConnectionManager created");
        return new ConnectionManager(coordinationClientFactory, lockMetrics);
    }

    @Bean
    @ConditionalOnMissingBean
    public LockRegistry lockRegistry() {
        return LockRegistry.global();
    }

    @Bean
    @ConditionalOnMissingBean(LockManager.class)
    @ConditionalOnProperty(prefix = "sakti.zk.lock", name = "enabled", havingValue = "true", matchIfMissing = true)
    public LockManager lockManager(ConnectionManager connectionManager, LockRegistry lockRegistry,
                                   LockMetrics lockMetrics) {
        log.info("✓ LockManager created");
        return new ZookeeperLockManager(connectionManager, properties.getNamespace(), lockRegistry, lockMetrics);
    }

    @Bean
    @ConditionalOnClass(name = "org.aspectj.lang.annotation.Aspect")
    @ConditionalOnProperty(prefix = "sakti.zk.lock", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ZkLockedAspect zkLockedAspect(LockManager lockManager) {
        log.info("✓ ZkLockedAspect created");
        return new ZkLockedAspect(lockManager);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // MIGRATION GUARD
    // ═══════════════════════════════════════════════════════════════════════════

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MigrationExecutor.class)
    @ConditionalOnProperty(prefix = "sakti.zk.migration", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MigrationGuard migrationGuard(MigrationExecutor migrationExecutor,
                                         ObjectProvider<LockManager> lockManager) {
        DistributedLock lock = null;
        LockManager manager = lockManager.getIfAvailable();
        if (properties.isCoordinationConfigured() && manager != null) {
            lock = manager.createLock(properties.getMigration().getLockKey());
        }
        log.info("✓ MigrationGuard created (guarded: {})", lock != null);
        return new MigrationGuard(migrationExecutor, lock);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(MigrationExecutor.class)
    @ConditionalOnProperty(prefix = "sakti.zk.migration", name = "enabled", havingValue = "true", matchIfMissing = true)
    public MigrationGuardRunner migrationGuardRunner(MigrationGuard migrationGuard) {
        return new MigrationGuardRunner(migrationGuard);
    }

    // ═══════════════════════════════════════════════════════════════════════════
    // WEB / HEALTH / METRICS
    // ═══════════════════════════════════════════════════════════════════════════

    @Configuration
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnClass(name = "jakarta.servlet.Filter")
    @ConditionalOnProperty(prefix = "sakti.zk.web", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class WebConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public ConnectionScopeFilter connectionScopeFilter(ConnectionManager connectionManager) {
            log.info("✓ ConnectionScopeFilter created");
            return new ConnectionScopeFilter(connectionManager);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
    @ConditionalOnProperty(prefix = "sakti.zk.health", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class HealthConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "zookeeperHealthIndicator")
        public ZookeeperHealthIndicator zookeeperHealthIndicator(ConnectionManager connectionManager,
                                                                 SaktiZkProperties properties) {
            return new ZookeeperHealthIndicator(connectionManager, properties);
        }
    }

    @Configuration
    @ConditionalOnClass(name = "io.micrometer.core.instrument.MeterRegistry")
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public SaktiZkMicrometerMetrics saktiZkMicrometerMetrics(LockMetrics lockMetrics) {
            return new SaktiZkMicrometerMetrics(lockMetrics);
        }
    }
}
