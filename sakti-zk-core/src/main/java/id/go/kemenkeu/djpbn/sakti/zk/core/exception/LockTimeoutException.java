package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Blocking acquisition was not granted within its timeout
 */
public class LockTimeoutException extends LockAcquisitionException {

    public LockTimeoutException(String key, Throwable cause) {
        super(key, "Timeout occurred while trying to acquire a blocking lock on " + key, cause);
    }
}
