package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Programmer error in how locks or connection scopes are used.
 * Never expected at runtime in a correctly wired application.
 */
public class LockConfigurationException extends IllegalStateException {

    public LockConfigurationException(String message) {
        super(message);
    }

    public LockConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
