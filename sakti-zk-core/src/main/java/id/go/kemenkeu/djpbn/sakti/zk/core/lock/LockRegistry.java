package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.DuplicateLockKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Key templates claimed by live locks.
 * <p>
 * Catches two locks accidentally built on the same key. Comparison is exact-string:
 * templates that may produce equal keys after substitution are not detected.
 */
public class LockRegistry {

    private static final Logger log = LoggerFactory.getLogger(LockRegistry.class);

    // one per process, shared by every lock manager unless one is given its own
    private static final LockRegistry GLOBAL = new LockRegistry();

    private final ConcurrentHashMap<String, LockRegistration> registrations = new ConcurrentHashMap<>();

    public static LockRegistry global() {
        return GLOBAL;
    }

    /**
     * @throws DuplicateLockKeyException if a live lock already holds the template
     */
    public LockRegistration register(String keyTemplate) {
        LockRegistration registration = new LockRegistration(this, keyTemplate);
        if (registrations.putIfAbsent(keyTemplate, registration) != null) {
            throw new DuplicateLockKeyException(keyTemplate);
        }
        log.debug("Lock key registered: {}", keyTemplate);
        return registration;
    }

    void unregister(LockRegistration registration) {
        if (registrations.remove(registration.getKeyTemplate(), registration)) {
            log.debug("Lock key unregistered: {}", registration.getKeyTemplate());
        }
    }

    public boolean isRegistered(String keyTemplate) {
        return registrations.containsKey(keyTemplate);
    }

    public Set<String> getRegisteredKeys() {
        return Set.copyOf(registrations.keySet());
    }
}
