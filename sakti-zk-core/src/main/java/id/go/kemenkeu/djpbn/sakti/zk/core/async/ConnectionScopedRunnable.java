package id.go.kemenkeu.djpbn.sakti.zk.core.async;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;

/**
 * Wrapper for Runnable that runs the task inside a connection scope
 * of whichever thread executes it
 */
public class ConnectionScopedRunnable implements Runnable {

    private final Runnable delegate;
    private final ConnectionManager connectionManager;

    public ConnectionScopedRunnable(Runnable delegate, ConnectionManager connectionManager) {
        this.delegate = delegate;
        this.connectionManager = connectionManager;
    }

    @Override
    public void run() {
        connectionManager.enterScope();
        try {
            delegate.run();
        } catch (Throwable t) {
            connectionManager.exitAfterFailure(t);
            throw t;
        }
        connectionManager.exitScope();
    }
}
