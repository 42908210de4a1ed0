package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Client-level signal that a blocking lock request ran out of time.
 * Translated to {@link LockTimeoutException} by the lock engine.
 */
public class CoordinationTimeoutException extends CoordinationException {

    public CoordinationTimeoutException(String message) {
        super(message);
    }
}
