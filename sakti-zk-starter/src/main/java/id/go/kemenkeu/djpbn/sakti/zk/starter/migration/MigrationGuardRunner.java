package id.go.kemenkeu.djpbn.sakti.zk.starter.migration;

import id.go.kemenkeu.djpbn.sakti.zk.core.lock.DistributedLock;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationGuard;
import id.go.kemenkeu.djpbn.sakti.zk.core.migration.MigrationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

import java.util.List;

/**
 * Runs the {@link MigrationGuard} on startup.
 * <p>
 * Options come from the command line:
 * {@code --migrate.target=0003 --migrate.fake --migrate.fake-initial --migrate.database=reporting}.
 */
public class MigrationGuardRunner implements ApplicationRunner, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(MigrationGuardRunner.class);

    static final String TARGET = "migrate.target";
    static final String FAKE = "migrate.fake";
    static final String FAKE_INITIAL = "migrate.fake-initial";
    static final String DATABASE = "migrate.database";

    private final MigrationGuard guard;

    public MigrationGuardRunner(MigrationGuard guard) {
        this.guard = guard;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        MigrationOptions options = optionsFrom(args);
        log.debug("Starting migration guard - {}", options);
        guard.migrate(options);
    }

    static MigrationOptions optionsFrom(ApplicationArguments args) {
        MigrationOptions options = MigrationOptions.defaults();
        options.setTarget(single(args, TARGET));
        options.setFake(flag(args, FAKE));
        options.setFakeInitial(flag(args, FAKE_INITIAL));
        String database = single(args, DATABASE);
        if (database != null && !database.isEmpty()) {
            options.setDatabase(database);
        }
        return options;
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }

    // bare --migrate.fake counts as true
    private static boolean flag(ApplicationArguments args, String name) {
        if (!args.containsOption(name)) {
            return false;
        }
        String value = single(args, name);
        return value == null || Boolean.parseBoolean(value);
    }

    public MigrationGuard getGuard() {
        return guard;
    }

    @Override
    public void destroy() {
        DistributedLock lock = guard.getLock();
        if (lock != null) {
            lock.close();
        }
    }
}
