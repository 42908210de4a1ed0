package id.go.kemenkeu.djpbn.sakti.zk.core.exception;

public class DuplicateLockKeyException extends LockConfigurationException {

    private final String keyTemplate;

    public DuplicateLockKeyException(String keyTemplate) {
        super("Attempt to register the same key twice: " + keyTemplate);
        this.keyTemplate = keyTemplate;
    }

    public String getKeyTemplate() {
        return keyTemplate;
    }
}
