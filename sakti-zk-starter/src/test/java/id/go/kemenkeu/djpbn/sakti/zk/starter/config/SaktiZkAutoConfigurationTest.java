package id.go.kemenkeu.djpbn.sakti.zk.starter.config;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockedException;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.DistributedLock;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockHandle;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockOptions;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockRegistry;
import id.go.kemenkeu.djpbn.sakti.zk.core.metrics.LockMetrics;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationExecutor;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationGuard;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationOptions;
import id.go.kemenkeu.djpbn.sakti.zk.starter.annotation.ZkLocked;
import id.go.kemenkeu.djpbn.sakti.zk.starter.aspect.ZkLockedAspect;
import id.go.kemenkeu.djpbn.sakti.zk.starter.filter.ConnectionScopeFilter;
import id.go.kemenkeu.djpbn.sakti.zk.starter.health.ZookeeperHealthIndicator;
import id.go.kemenkeu.djpbn.sakti.zk.starter.metrics.SaktiZkMicrometerMetrics;
import id.go.kemenkeu.djpbn.sakti.zk.starter.migration.MigrationGuardRunner;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.aop.AopAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SaktiZkAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(SaktiZkAutoConfiguration.class, AopAutoConfiguration.class))
        .withBean(LockRegistry.class, LockRegistry::new);

    @Nested
    @DisplayName("Core beans")
    class CoreBeanTests {

        @Test
        @DisplayName("Should create the lock stack with defaults")
        void testDefaults() {
            contextRunner.run(context -> {
                assertNotNull(context.getBean(LockMetrics.class));
                assertNotNull(context.getBean(ConnectionManager.class));
                assertNotNull(context.getBean(LockManager.class));
                assertNotNull(context.getBean(ZkLockedAspect.class));
                assertNotNull(context.getBean(ZookeeperHealthIndicator.class));
                assertNotNull(context.getBean(SaktiZkMicrometerMetrics.class));
                assertTrue(context.getBeansOfType(ConnectionScopeFilter.class).isEmpty());
                assertTrue(context.getBeansOfType(MigrationGuard.class).isEmpty());
            });
        }

        @Test
        @DisplayName("Should bind properties")
        void testProperties() {
            contextRunner
                .withPropertyValues(
                    "sakti.zk.hosts=zk1:2181,zk2:2181",
                    "sakti.zk.namespace=billing",
                    "sakti.zk.client-mode=in-memory",
                    "sakti.zk.retry.max-retries=5",
                    "sakti.zk.migration.lock-key=schema")
                .run(context -> {
                    SaktiZkProperties properties = context.getBean(SaktiZkProperties.class);
                    assertEquals(List.of("zk1:2181", "zk2:2181"), properties.getHosts());
                    assertEquals(SaktiZkProperties.ClientMode.IN_MEMORY, properties.getClientMode());
                    assertEquals(5, properties.getRetry().getMaxRetries());
                    assertEquals("schema", properties.getMigration().getLockKey());
                    assertEquals("zk1:2181,zk2:2181", properties.toSettings().getConnectString());
                });
        }

        @Test
        @DisplayName("Disabling locks should remove the lock manager and aspect")
        void testLockDisabled() {
            contextRunner.withPropertyValues("sakti.zk.lock.enabled=false").run(context -> {
                assertTrue(context.getBeansOfType(LockManager.class).isEmpty());
                assertTrue(context.getBeansOfType(ZkLockedAspect.class).isEmpty());
                assertNotNull(context.getBean(ConnectionManager.class));
            });
        }

        @Test
        @DisplayName("Should lock end to end with the in-memory client")
        void testInMemoryLocking() {
            String namespace = "it-" + UUID.randomUUID();
            contextRunner
                .withPropertyValues("sakti.zk.client-mode=in-memory", "sakti.zk.namespace=" + namespace)
                .run(context -> {
                    DistributedLock lock = context.getBean(LockManager.class).createLock("job-{id}");
                    LockOptions options = LockOptions.nonBlocking().param("id", 7);

                    LockHandle handle = lock.acquire(options);
                    try {
                        assertEquals("/locks/" + namespace + "/job-7", handle.getPath());
                        Throwable failure = CompletableFuture.supplyAsync(() -> {
                            try {
                                lock.acquire(options).release();
                                return null;
                            } catch (RuntimeException e) {
                                return (Throwable) e;
                            }
                        }).get(5, TimeUnit.SECONDS);
                        assertTrue(failure instanceof LockedException);
                    } finally {
                        handle.release();
                    }
                    assertEquals(1, context.getBean(LockMetrics.class).getLockedRejections());
                });
        }

        @Test
        @DisplayName("Annotated beans should be locked through the aspect")
        void testAnnotatedBean() {
            contextRunner
                .withPropertyValues("sakti.zk.client-mode=in-memory", "sakti.zk.namespace=it-" + UUID.randomUUID())
                .withBean(ReportService.class)
                .run(context -> {
                    ReportService reports = context.getBean(ReportService.class);
                    ConnectionManager connectionManager = context.getBean(ConnectionManager.class);

                    assertEquals("report 3 locked=true", reports.build(3, connectionManager));
                    assertTrue(context.getBean(ZkLockedAspect.class).getLocks().containsKey("report-{year}"));
                    assertEquals(1, context.getBean(LockMetrics.class).getAcquiredLocks());
                });
        }
    }

    @Nested
    @DisplayName("Migration guard")
    class MigrationTests {

        @Test
        @DisplayName("Should guard migrations when an executor is present")
        void testGuarded() {
            contextRunner
                .withPropertyValues("sakti.zk.client-mode=in-memory")
                .withBean(MigrationExecutor.class, NoMigrations::new)
                .run(context -> {
                    MigrationGuard guard = context.getBean(MigrationGuard.class);
                    assertTrue(guard.isGuarded());
                    assertEquals("migrations", guard.getLock().getKey());
                    assertNotNull(context.getBean(MigrationGuardRunner.class));
                });
        }

        @Test
        @DisplayName("Should run unguarded without hosts")
        void testUnguarded() {
            contextRunner
                .withBean(MigrationExecutor.class, NoMigrations::new)
                .run(context -> assertFalse(context.getBean(MigrationGuard.class).isGuarded()));
        }

        @Test
        @DisplayName("Should free the migration key when the context closes")
        void testKeyReleasedOnClose() {
            LockRegistry registry = new LockRegistry();
            ApplicationContextRunner runner = new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(SaktiZkAutoConfiguration.class))
                .withBean(LockRegistry.class, () -> registry)
                .withBean(MigrationExecutor.class, NoMigrations::new)
                .withPropertyValues("sakti.zk.client-mode=in-memory");

            runner.run(context -> assertTrue(registry.isRegistered("migrations")));
            assertFalse(registry.isRegistered("migrations"));
            runner.run(context -> assertTrue(context.getBean(MigrationGuard.class).isGuarded()));
        }

        @Test
        @DisplayName("Disabling the guard should skip it")
        void testDisabled() {
            contextRunner
                .withPropertyValues("sakti.zk.migration.enabled=false")
                .withBean(MigrationExecutor.class, NoMigrations::new)
                .run(context -> assertTrue(context.getBeansOfType(MigrationGuardRunner.class).isEmpty()));
        }
    }

    @Test
    @DisplayName("Servlet applications should get the request filter")
    void testWebFilter() {
        new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SaktiZkAutoConfiguration.class))
            .withBean(LockRegistry.class, LockRegistry::new)
            .run(context -> assertNotNull(context.getBean(ConnectionScopeFilter.class)));

        new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(SaktiZkAutoConfiguration.class))
            .withBean(LockRegistry.class, LockRegistry::new)
            .withPropertyValues("sakti.zk.web.enabled=false")
            .run(context -> assertTrue(context.getBeansOfType(ConnectionScopeFilter.class).isEmpty()));
    }

    static class NoMigrations implements MigrationExecutor {

        @Override
        public boolean hasPendingMigrations() {
            return false;
        }

        @Override
        public void migrate(MigrationOptions options) {
        }
    }

    public static class ReportService {

        @ZkLocked(key = "report-{year}")
        public String build(int year, ConnectionManager connectionManager) {
            return "report " + year + " locked=" + connectionManager.isManaged();
        }
    }
}
