package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * The coordination service session is gone (expired, lost or closed).
 * <p>
 * Passed through to callers unchanged; the connection manager reconnects
 * the thread's client on the way out so the next scope starts clean.
 */
public class SessionClosedException extends RuntimeException {

    public SessionClosedException(String message) {
        super(message);
    }

    public SessionClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
