package id.go.kemenkeu.djpbn.sakti.zk.core.async;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * ThreadFactory for worker pools whose threads keep one connection for their whole life.
 * <p>
 * Each worker enters a connection scope when it starts and exits it when it terminates,
 * so every task on the worker reuses the worker's client. A worker killed with the
 * process never exits its scope; the service drops the session when it expires.
 */
public class ConnectionScopedThreadFactory implements ThreadFactory {

    private static final Logger log = LoggerFactory.getLogger(ConnectionScopedThreadFactory.class);

    private final ThreadFactory delegate;
    private final ConnectionManager connectionManager;

    public ConnectionScopedThreadFactory(ConnectionManager connectionManager) {
        this(Executors.defaultThreadFactory(), connectionManager);
    }

    public ConnectionScopedThreadFactory(ThreadFactory delegate, ConnectionManager connectionManager) {
        this.delegate = delegate;
        this.connectionManager = connectionManager;
    }

    /**
     * Fixed-size pool whose workers each hold a connection scope
     */
    public static ExecutorService newFixedThreadPool(int threads, ConnectionManager connectionManager) {
        return Executors.newFixedThreadPool(threads, new ConnectionScopedThreadFactory(connectionManager));
    }

    @Override
    public Thread newThread(Runnable worker) {
        return delegate.newThread(new ConnectionScopedRunnable(() -> {
            log.debug("Worker connection scope opened - thread: {}", Thread.currentThread().getName());
            try {
                worker.run();
            } finally {
                log.debug("Worker connection scope closing - thread: {}", Thread.currentThread().getName());
            }
        }, connectionManager));
    }
}
