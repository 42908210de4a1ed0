package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Raised when the connection is used outside of a scope, or a scope is
 * exited more times than it was entered on the current thread.
 */
public class ConnectionScopeException extends LockConfigurationException {

    public ConnectionScopeException(String message) {
        super(message);
    }
}
