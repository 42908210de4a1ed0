package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.CoordinationTimeoutException;
import org.apache.curator.framework.recipes.locks.InterProcessLock;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

public class CuratorRemoteLock implements RemoteLock {

    private final InterProcessLock mutex;
    private final String path;

    public CuratorRemoteLock(InterProcessLock mutex, String path) {
        this.mutex = mutex;
        this.path = path;
    }

    @Override
    public boolean acquire(boolean blocking, Duration timeout) {
        boolean acquired;
        try {
            if (!blocking) {
                acquired = mutex.acquire(0, TimeUnit.MILLISECONDS);
            } else if (timeout == null) {
                mutex.acquire();
                acquired = true;
            } else {
                acquired = mutex.acquire(timeout.toMillis(), TimeUnit.MILLISECONDS);
            }
        } catch (Exception e) {
            throw CuratorCoordinationClient.translate("acquire", path, e);
        }

        if (blocking && !acquired) {
            throw new CoordinationTimeoutException("Lock " + path + " not granted within " + timeout);
        }
        return acquired;
    }

    @Override
    public void release() {
        try {
            mutex.release();
        } catch (Exception e) {
            throw CuratorCoordinationClient.translate("release", path, e);
        }
    }

    @Override
    public String getPath() {
        return path;
    }
}
