package id.go.kemenkeu.djpbn.sakti.zk.core.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for lock and connection activity.
 * Dependency-free; the starter bridges them to Micrometer.
 */
public class LockMetrics {

    private final AtomicLong acquiredLocks = new AtomicLong(0);
    private final AtomicLong reentrantGrants = new AtomicLong(0);
    private final AtomicLong lockedRejections = new AtomicLong(0);
    private final AtomicLong timeouts = new AtomicLong(0);
    private final AtomicLong releasedLocks = new AtomicLong(0);

    private final AtomicLong connectionsOpened = new AtomicLong(0);
    private final AtomicLong connectionsClosed = new AtomicLong(0);
    private final AtomicLong reconnects = new AtomicLong(0);

    public void recordAcquired() {
        acquiredLocks.incrementAndGet();
    }

    public void recordReentrant() {
        reentrantGrants.incrementAndGet();
    }

    public void recordLocked() {
        lockedRejections.incrementAndGet();
    }

    public void recordTimeout() {
        timeouts.incrementAndGet();
    }

    public void recordReleased() {
        releasedLocks.incrementAndGet();
    }

    public void recordConnectionOpened() {
        connectionsOpened.incrementAndGet();
    }

    public void recordConnectionClosed() {
        connectionsClosed.incrementAndGet();
    }

    public void recordReconnect() {
        reconnects.incrementAndGet();
    }

    /**
     * Locks currently held through the service (acquired minus released)
     */
    public long getHeldLocks() {
        return acquiredLocks.get() - releasedLocks.get();
    }

    /**
     * Connections currently open across all threads
     */
    public long getOpenConnections() {
        return connectionsOpened.get() - connectionsClosed.get();
    }

    // Getters
    public long getAcquiredLocks() { return acquiredLocks.get(); }
    public long getReentrantGrants() { return reentrantGrants.get(); }
    public long getLockedRejections() { return lockedRejections.get(); }
    public long getTimeouts() { return timeouts.get(); }
    public long getReleasedLocks() { return releasedLocks.get(); }
    public long getConnectionsOpened() { return connectionsOpened.get(); }
    public long getConnectionsClosed() { return connectionsClosed.get(); }
    public long getReconnects() { return reconnects.get(); }
}
