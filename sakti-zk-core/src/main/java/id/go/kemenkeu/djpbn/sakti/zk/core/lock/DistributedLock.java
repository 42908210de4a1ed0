package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.connection.CoordinationClient;
import id.go.kemenkeu.djpbn.sakti.zk.core.connection.RemoteLock;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.CoordinationException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.CoordinationTimeoutException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockAcquisitionException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockConfigurationException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockTimeoutException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockedException;
import id.go.kemenkeu.djpbn.sakti.zk.core.metrics.LockMetrics;
import id.go.kemenkeu.djpbn.sakti.zk.core.wrapper.CheckedRunnable;
import id.go.kemenkeu.djpbn.sakti.zk.core.wrapper.CheckedSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Exclusive lock stored at {@code /locks/{namespace}/{key}} in the coordination service.
 * <p>
 * The key is a {@link KeyTemplate}; each acquisition fills its placeholders to get the
 * concrete key. A thread that already holds a concrete key through this lock is granted
 * it again without contacting the service, so nested critical sections do not deadlock.
 * That reentrancy is per lock object, per thread and per process.
 * <p>
 * Example:
 * <pre>{@code
 * DistributedLock lock = lockManager.createLock("my-lock-{objectId}");
 *
 * lock.run(LockOptions.defaults().param("objectId", 123), () -> {
 *     // so alone
 * });
 *
 * LockHandle handle = lock.acquire(LockOptions.defaults().param("objectId", 123));
 * try {
 *     work();
 * } catch (Throwable t) {
 *     handle.releaseAfterFailure(t);
 *     throw t;
 * }
 * handle.release();
 *
 * try {
 *     lock.run(LockOptions.withTimeout(Duration.ofSeconds(9)).param("objectId", 123), this::work);
 * } catch (LockTimeoutException e) {
 *     // unable to lock after waiting for 9s
 * }
 *
 * try {
 *     lock.run(LockOptions.nonBlocking().param("objectId", 123), this::work);
 * } catch (LockedException e) {
 *     // unable to lock immediately
 * }
 * }</pre>
 */
public class DistributedLock implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DistributedLock.class);

    private final KeyTemplate template;
    private final LockRegistration registration;
    private final ConnectionManager connectionManager;
    private final String namespace;
    private final HeldKeys heldKeys;
    private final LockMetrics metrics;

    DistributedLock(KeyTemplate template, LockRegistration registration, ConnectionManager connectionManager,
                    String namespace, HeldKeys heldKeys, LockMetrics metrics) {
        this.template = template;
        this.registration = registration;
        this.connectionManager = connectionManager;
        this.namespace = namespace;
        this.heldKeys = heldKeys;
        this.metrics = metrics;
    }

    /**
     * Acquire the lock for the concrete key built from {@code options}. The caller owns the
     * returned handle and must end it with {@link LockHandle#release()}, or with
     * {@link LockHandle#releaseAfterFailure(Throwable)} when the guarded work failed.
     *
     * @throws LockedException         if a non-blocking attempt found the lock taken
     * @throws LockTimeoutException    if a blocking attempt ran out of time
     * @throws LockAcquisitionException on any other failure reported by the service
     * @throws id.go.kemenkeu.djpbn.sakti.zk.core.exception.SessionClosedException
     *         if the session was lost while acquiring
     */
    public LockHandle acquire(LockOptions options) {
        if (registration.isClosed()) {
            throw new LockConfigurationException("Lock " + template + " has been closed");
        }

        String key = template.format(options.getParams());
        String path = pathFor(key);

        if (heldKeys.contains(key)) {
            log.debug("Lock already held by current thread - reentrant grant: {}", key);
            if (metrics != null) {
                metrics.recordReentrant();
            }
            return new ReentrantHandle(key, path);
        }

        connectionManager.enterScope();
        RemoteLock remoteLock;
        boolean acquired;
        try {
            CoordinationClient client = connectionManager.getClient();
            remoteLock = client.createLock(path);
            log.info("Acquiring lock - namespace: {}, key: {}", namespace, key);
            acquired = remoteLock.acquire(options.isBlocking(), options.getTimeout());
        } catch (CoordinationTimeoutException e) {
            if (metrics != null) {
                metrics.recordTimeout();
            }
            throw exitWith(new LockTimeoutException(key, e));
        } catch (CoordinationException e) {
            throw exitWith(new LockAcquisitionException(key, "Failed to acquire lock on " + key, e));
        } catch (RuntimeException | Error e) {
            connectionManager.exitAfterFailure(e);
            throw e;
        }

        if (!acquired) {
            log.warn("Failed to acquire non-blocking lock: {}", key);
            if (metrics != null) {
                metrics.recordLocked();
            }
            throw exitWith(new LockedException(key));
        }

        heldKeys.add(key);
        if (metrics != null) {
            metrics.recordAcquired();
        }
        log.debug("Lock acquired: {}", key);
        return new RemoteHandle(key, path, remoteLock);
    }

    /**
     * Run {@code action} while holding the lock and return its result
     */
    public <T> T execute(LockOptions options, CheckedSupplier<T> action) throws Exception {
        LockHandle handle = acquire(options);
        T result;
        try {
            result = action.get();
        } catch (Throwable t) {
            handle.releaseAfterFailure(t);
            throw t;
        }
        handle.release();
        return result;
    }

    public void run(LockOptions options, CheckedRunnable action) throws Exception {
        execute(options, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Whether the current thread of this process holds the concrete key for {@code params}
     */
    public boolean isHeldByCurrentThread(Map<String, ?> params) {
        return heldKeys.contains(template.format(params));
    }

    public String pathFor(String key) {
        return "/locks/" + namespace + "/" + key;
    }

    public KeyTemplate getTemplate() {
        return template;
    }

    public String getKey() {
        return template.getTemplate();
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * Give the key template back to the registry. The lock cannot be acquired afterwards.
     */
    @Override
    public void close() {
        registration.close();
    }

    private <E extends Throwable> E exitWith(E failure) {
        connectionManager.exitAfterFailure(failure);
        return failure;
    }

    private abstract static class AbstractHandle implements LockHandle {

        private final String key;
        private final String path;
        private final long ownerThreadId = Thread.currentThread().getId();
        private final AtomicBoolean released = new AtomicBoolean(false);

        AbstractHandle(String key, String path) {
            this.key = key;
            this.path = path;
        }

        @Override
        public String getKey() {
            return key;
        }

        @Override
        public String getPath() {
            return path;
        }

        @Override
        public void release() {
            if (claimRelease()) {
                doRelease(null);
            }
        }

        @Override
        public void releaseAfterFailure(Throwable failure) {
            if (claimRelease()) {
                doRelease(failure);
            }
        }

        private boolean claimRelease() {
            if (Thread.currentThread().getId() != ownerThreadId) {
                throw new LockConfigurationException("Lock " + key + " must be released by the thread that acquired it");
            }
            return released.compareAndSet(false, true);
        }

        abstract void doRelease(Throwable failure);
    }

    private static final class ReentrantHandle extends AbstractHandle {

        ReentrantHandle(String key, String path) {
            super(key, path);
        }

        @Override
        public boolean isReentrant() {
            return true;
        }

        @Override
        void doRelease(Throwable failure) {
            // the outer holder releases
        }
    }

    private final class RemoteHandle extends AbstractHandle {

        private final RemoteLock remoteLock;

        RemoteHandle(String key, String path, RemoteLock remoteLock) {
            super(key, path);
            this.remoteLock = remoteLock;
        }

        @Override
        public boolean isReentrant() {
            return false;
        }

        @Override
        void doRelease(Throwable failure) {
            RuntimeException releaseFailure = null;
            try {
                remoteLock.release();
                if (metrics != null) {
                    metrics.recordReleased();
                }
                log.debug("Lock released: {}", getKey());
            } catch (RuntimeException e) {
                log.error("Failed to release lock: {}", getKey(), e);
                releaseFailure = e;
            } finally {
                heldKeys.remove(getKey());
            }

            if (failure == null && releaseFailure == null) {
                connectionManager.exitScope();
            } else if (failure == null) {
                throw exitWith(releaseFailure);
            } else {
                if (releaseFailure != null) {
                    failure.addSuppressed(releaseFailure);
                }
                connectionManager.exitAfterFailure(failure);
            }
        }
    }
}
