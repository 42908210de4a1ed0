package id.go.kemenkeu.djpbn.sakti.zk.core.migration;

/**
 * Host application's schema migration tool, as seen by {@link MigrationGuard}.
 */
public interface MigrationExecutor {

    /**
     * @throws id.go.kemenkeu.djpbn.sakti.zk.core.exception.MigrationConfigurationException
     *         if the database cannot be inspected
     */
    boolean hasPendingMigrations();

    void migrate(MigrationOptions options) throws Exception;
}
