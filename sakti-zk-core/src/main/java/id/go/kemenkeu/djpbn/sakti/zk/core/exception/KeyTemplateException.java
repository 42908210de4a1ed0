package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

/**
 * Lock key template is malformed or cannot be formatted with the given parameters
 */
public class KeyTemplateException extends IllegalArgumentException {

    public KeyTemplateException(String message) {
        super(message);
    }
}
