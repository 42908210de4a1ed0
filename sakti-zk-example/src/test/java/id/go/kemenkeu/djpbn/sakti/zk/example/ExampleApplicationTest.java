package id.go.kemenkeu.djpbn.sakti.zk.example;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.metrics.LockMetrics;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationGuard;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ExampleApplicationTest {

    @Autowired
    private SampleService sampleService;

    @Autowired
    private JdbcTemplate jdbcTemplateMain;

    @Autowired
    private MigrationGuard migrationGuard;

    @Autowired
    private ConnectionManager connectionManager;

    @Autowired
    private LockMetrics lockMetrics;

    @Test
    @DisplayName("Startup should have applied the migrations under the lock")
    void testMigrationsApplied() throws Exception {
        assertTrue(migrationGuard.isGuarded());
        assertEquals(2, jdbcTemplateMain.queryForObject("SELECT COUNT(*) FROM schema_migrations", Integer.class));
        assertFalse(migrationGuard.migrate(MigrationOptions.defaults()));
    }

    @Test
    @DisplayName("Annotated work should run under its lock")
    void testLockedWork() {
        long acquired = lockMetrics.getAcquiredLocks();

        sampleService.doWork("ORD-1");

        assertEquals("processed",
            jdbcTemplateMain.queryForObject("SELECT val FROM demo WHERE id = ?", String.class, "ORD-1"));
        assertEquals(acquired + 1, lockMetrics.getAcquiredLocks());
        assertFalse(connectionManager.isManaged());
        assertTrue(sampleService.sync().startsWith("Synced"));
    }

    @Test
    @DisplayName("Background refresh should run on a scoped worker")
    void testBackgroundRefresh() throws Exception {
        assertEquals("Refreshed demo", sampleService.refreshInBackground("demo").get(5, TimeUnit.SECONDS));
    }
}
