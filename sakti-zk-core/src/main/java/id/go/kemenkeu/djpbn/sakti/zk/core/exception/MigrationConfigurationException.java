package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Thrown by a migration executor that cannot inspect its database
 * (none configured, or a dummy one)
 */
public class MigrationConfigurationException extends RuntimeException {

    public MigrationConfigurationException(String message) {
        super(message);
    }

    public MigrationConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
