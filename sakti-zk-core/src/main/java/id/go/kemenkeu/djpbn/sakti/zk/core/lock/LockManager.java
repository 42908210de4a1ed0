package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

public interface LockManager {

    /**
     * Create a lock for a key template and claim the template in the registry.
     *
     * @throws id.go.kemenkeu.djpbn.sakti.zk.core.exception.DuplicateLockKeyException
     *         if a live lock already uses the template
     */
    DistributedLock createLock(String keyTemplate);
}
