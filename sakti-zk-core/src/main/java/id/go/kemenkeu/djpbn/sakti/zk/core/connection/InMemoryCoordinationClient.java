package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.CoordinationException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.CoordinationTimeoutException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.SessionClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * In-JVM stand-in for the coordination service.
 * <p>
 * Paths are exclusive across every client in the JVM, and locks held by a client
 * are dropped when its "session" ends (stop or restart), as ephemeral nodes would be.
 * A path is only tracked while some lock holds or waits for it.
 * Suitable for tests and single-node development.
 */
public class InMemoryCoordinationClient implements CoordinationClient {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCoordinationClient.class);

    private static final ConcurrentHashMap<String, PathEntry> PATHS = new ConcurrentHashMap<>();

    private final Set<InMemoryRemoteLock> held = ConcurrentHashMap.newKeySet();
    private volatile boolean started;

    @Override
    public void start() {
        started = true;
    }

    @Override
    public void stop() {
        started = false;
        endSession();
    }

    @Override
    public void restart() {
        stop();
        start();
    }

    @Override
    public boolean isConnected() {
        return started;
    }

    @Override
    public RemoteLock createLock(String path) {
        if (!started) {
            throw new SessionClosedException("Client is not started - cannot create lock " + path);
        }
        return new InMemoryRemoteLock(path);
    }

    static boolean isTracked(String path) {
        return PATHS.containsKey(path);
    }

    private static PathEntry join(String path) {
        return PATHS.compute(path, (p, entry) -> {
            PathEntry joined = entry == null ? new PathEntry() : entry;
            joined.users++;
            return joined;
        });
    }

    private static void leave(String path) {
        PATHS.computeIfPresent(path, (p, entry) -> --entry.users == 0 ? null : entry);
    }

    private void endSession() {
        for (InMemoryRemoteLock lock : held) {
            log.debug("Session ended - dropping lock {}", lock.path);
            lock.release();
        }
    }

    /**
     * Users counts the locks holding or waiting for the path; only touched inside map compute calls
     */
    private static final class PathEntry {
        private final Semaphore semaphore = new Semaphore(1);
        private int users;
    }

    private class InMemoryRemoteLock implements RemoteLock {

        private final String path;
        private volatile boolean acquired;

        InMemoryRemoteLock(String path) {
            this.path = path;
        }

        @Override
        public boolean acquire(boolean blocking, Duration timeout) {
            Semaphore semaphore = join(path).semaphore;
            boolean granted = false;
            try {
                if (!blocking) {
                    granted = semaphore.tryAcquire();
                } else if (timeout == null) {
                    semaphore.acquire();
                    granted = true;
                } else if (semaphore.tryAcquire(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    granted = true;
                } else {
                    throw new CoordinationTimeoutException("Lock " + path + " not granted within " + timeout);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CoordinationException("Interrupted while trying to acquire " + path, e);
            } finally {
                if (!granted) {
                    leave(path);
                }
            }

            if (!granted) {
                return false;
            }
            acquired = true;
            held.add(this);
            return true;
        }

        @Override
        public synchronized void release() {
            if (acquired) {
                acquired = false;
                held.remove(this);
                PATHS.get(path).semaphore.release();
                leave(path);
            }
        }

        @Override
        public String getPath() {
            return path;
        }
    }
}
