package id.go.kemenkeu.djpbn.sakti.zk.core.migration;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.MigrationConfigurationException;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.DistributedLock;
import id.go.kemenkeu.djpbn.sakti.zk.core.lock.LockOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs schema migrations inside a critical section so that only one node migrates at a time.
 * <p>
 * The lock is taken when the run was started with non-default options or there are
 * pending migrations. Without coordination hosts (no lock) migrations run unguarded.
 */
public class MigrationGuard {

    public static final String DEFAULT_LOCK_KEY = "migrations";

    private static final Logger log = LoggerFactory.getLogger(MigrationGuard.class);

    private final MigrationExecutor executor;
    private final DistributedLock lock;
    private final AtomicBoolean unguardedWarned = new AtomicBoolean(false);

    /**
     * @param lock the migration lock, or {@code null} when no coordination hosts are configured
     */
    public MigrationGuard(MigrationExecutor executor, DistributedLock lock) {
        if (executor == null) {
            throw new IllegalArgumentException("MigrationExecutor cannot be null");
        }
        this.executor = executor;
        this.lock = lock;
    }

    /**
     * @return true if migrations were run
     */
    public boolean migrate(MigrationOptions options) throws Exception {
        log.info("Potential data migration will be assisted by ZooKeeper locks.");

        boolean pending;
        try {
            pending = executor.hasPendingMigrations();
        } catch (MigrationConfigurationException e) {
            // no usable database - let the executor decide what to do
            log.debug("Cannot inspect migrations: {}", e.getMessage());
            pending = true;
        }

        if (options.isLaunchedWithDefaults() && !pending) {
            log.info("No migrations to apply.");
            return false;
        }

        if (lock == null) {
            if (unguardedWarned.compareAndSet(false, true)) {
                log.warn("No coordination hosts configured - ZooKeeper locks will not protect the current data migration process.");
            }
            executor.migrate(options);
        } else {
            lock.run(LockOptions.defaults(), () -> executor.migrate(options));
        }
        return true;
    }

    public boolean isGuarded() {
        return lock != null;
    }

    public DistributedLock getLock() {
        return lock;
    }
}
