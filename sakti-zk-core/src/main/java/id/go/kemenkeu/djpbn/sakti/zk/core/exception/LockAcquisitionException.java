package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Base type for failures to obtain a distributed lock.
 * Carries the concrete key (template with parameters substituted).
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }
    
    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
