package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Any other failure reported by the coordination service client
 */
public class CoordinationException extends RuntimeException {

    public CoordinationException(String message) {
        super(message);
    }

    public CoordinationException(String message, Throwable cause) {
        super(message, cause);
    }
}
