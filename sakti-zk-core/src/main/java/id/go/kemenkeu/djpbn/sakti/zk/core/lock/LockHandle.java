package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

/**
 * A granted lock. Release it on the thread that acquired it, exactly once;
 * further calls are ignored.
 * <p>
 * Prefer {@link DistributedLock#execute} or {@link DistributedLock#run}, which
 * route a failing body through {@link #releaseAfterFailure(Throwable)}. Code holding
 * a handle directly must do the same on its failure path, otherwise a lost session
 * is not recovered when the scope exits.
 */
public interface LockHandle {

    String getKey();

    String getPath();

    /**
     * True when the current thread already held the key and the service was not contacted
     */
    boolean isReentrant();

    void release();

    /**
     * Release after the guarded work failed. {@code failure} stays the primary error:
     * release problems are attached to it as suppressed, and a session-closed failure
     * lets the connection manager reconnect.
     */
    void releaseAfterFailure(Throwable failure);
}
