package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Non-blocking acquisition found the lock already taken
 */
public class LockedException extends LockAcquisitionException {

    public LockedException(String key) {
        super(key, "Failed to acquire a non-blocking lock on " + key);
    }
}
