package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

import java.time.Duration;

/**
 * Exclusive lock on a single coordination-service path.
 * Created fresh for every acquisition attempt and never reused.
 */
public interface RemoteLock {

    /**
     * @param blocking false to try once without waiting
     * @param timeout  maximum wait for a blocking request, {@code null} to wait indefinitely
     * @return true if granted, false if a non-blocking request found the lock taken
     * @throws id.go.kemenkeu.djpbn.sakti.zk.core.exception.CoordinationTimeoutException
     *         if a blocking request with a timeout was not granted in time
     */
    boolean acquire(boolean blocking, Duration timeout);

    void release();

    String getPath();
}
