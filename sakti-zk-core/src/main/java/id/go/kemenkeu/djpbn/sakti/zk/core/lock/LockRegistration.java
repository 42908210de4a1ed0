package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claim on a key template in a {@link LockRegistry}. Closing it frees the key.
 */
public final class LockRegistration implements AutoCloseable {

    private final LockRegistry registry;
    private final String keyTemplate;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    LockRegistration(LockRegistry registry, String keyTemplate) {
        this.registry = registry;
        this.keyTemplate = keyTemplate;
    }

    public String getKeyTemplate() {
        return keyTemplate;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            registry.unregister(this);
        }
    }
}
