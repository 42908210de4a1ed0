package id.go.kemenkeu.djpbn.sakti.zk.example;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.MigrationConfigurationException;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationExecutor;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Minimal ordered SQL migrations tracked in a {@code schema_migrations} table
 */
public class JdbcMigrationExecutor implements MigrationExecutor {

    private static final Logger log = LoggerFactory.getLogger(JdbcMigrationExecutor.class);

    public static final Map<String, String> EXAMPLE_MIGRATIONS = exampleMigrations();

    private final JdbcTemplate jdbcTemplate;
    private final Map<String, String> migrations;

    public JdbcMigrationExecutor(JdbcTemplate jdbcTemplate, Map<String, String> migrations) {
        this.jdbcTemplate = jdbcTemplate;
        this.migrations = migrations;
    }

    @Override
    public boolean hasPendingMigrations() {
        try {
            return !pending(null).isEmpty();
        } catch (DataAccessException e) {
            throw new MigrationConfigurationException("Cannot read schema_migrations", e);
        }
    }

    @Override
    public void migrate(MigrationOptions options) {
        if (!MigrationOptions.DEFAULT_DATABASE.equals(options.getDatabase())) {
            throw new MigrationConfigurationException("Unknown database: " + options.getDatabase());
        }
        for (String id : pending(options.getTarget())) {
            boolean fake = options.isFake() || (options.isFakeInitial() && id.equals(firstId()));
            if (fake) {
                log.info("Faking migration {}", id);
            } else {
                log.info("Applying migration {}", id);
                jdbcTemplate.execute(migrations.get(id));
            }
            jdbcTemplate.update("INSERT INTO schema_migrations(id) VALUES(?)", id);
        }
    }

    private Set<String> pending(String target) {
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS schema_migrations (id VARCHAR(64) PRIMARY KEY)");
        List<String> applied = jdbcTemplate.queryForList("SELECT id FROM schema_migrations", String.class);

        Set<String> pending = new TreeSet<>(migrations.keySet());
        pending.removeAll(applied);
        if (target != null && !target.isEmpty()) {
            pending.removeIf(id -> id.compareTo(target) > 0);
        }
        return pending;
    }

    private String firstId() {
        return new TreeSet<>(migrations.keySet()).first();
    }

    private static Map<String, String> exampleMigrations() {
        Map<String, String> migrations = new LinkedHashMap<>();
        migrations.put("0001", "CREATE TABLE IF NOT EXISTS demo (id VARCHAR(64) PRIMARY KEY, val VARCHAR(128))");
        migrations.put("0002", "ALTER TABLE demo ADD COLUMN IF NOT EXISTS processed_at TIMESTAMP");
        return Map.copyOf(migrations);
    }
}
