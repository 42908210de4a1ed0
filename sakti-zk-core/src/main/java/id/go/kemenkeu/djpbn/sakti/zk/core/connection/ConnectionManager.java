package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.ConnectionScopeException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.SessionClosedException;
import id.go.kemenkeu.djpbn.sakti.zk.core.metrics.LockMetrics;
import id.go.kemenkeu.djpbn.sakti.zk.core.wrapper.CheckedRunnable;
import id.go.kemenkeu.djpbn.sakti.zk.core.wrapper.CheckedSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Shares one coordination-service connection between nested scopes of a thread.
 * <p>
 * Every scope entered on a thread increments that thread's reference count, and
 * the client is created lazily by the first {@link #getClient()} call. When the
 * outermost scope exits the client is stopped and dropped. State is kept per
 * thread and shared by all instances of this class, so two managers on the same
 * thread see the same count and the same client.
 * <p>
 * Usage:
 * <pre>{@code
 * connectionManager.enterScope();
 * try {
 *     CoordinationClient client = connectionManager.getClient();
 *     // ...
 * } finally {
 *     connectionManager.exitScope();
 * }
 * }</pre>
 * or {@link #callInScope(CheckedSupplier)}, which also passes the failure to
 * {@link #exitScope(Throwable)}.
 */
public class ConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

    private static final ThreadLocal<ScopeState> SCOPE_STATE = ThreadLocal.withInitial(ScopeState::new);

    private final CoordinationClientFactory clientFactory;
    private final LockMetrics metrics;

    public ConnectionManager(CoordinationClientFactory clientFactory) {
        this(clientFactory, null);
    }

    public ConnectionManager(CoordinationClientFactory clientFactory, LockMetrics metrics) {
        if (clientFactory == null) {
            throw new IllegalArgumentException("CoordinationClientFactory cannot be null");
        }
        this.clientFactory = clientFactory;
        this.metrics = metrics;
    }

    /**
     * Increment the reference count of the current thread
     */
    public void enterScope() {
        ScopeState state = SCOPE_STATE.get();
        state.mutex.lock();
        try {
            state.referenceCount++;
            log.debug("Entered connection scope - thread: {}, depth: {}",
                Thread.currentThread().getId(), state.referenceCount);
        } finally {
            state.mutex.unlock();
        }
    }

    public void exitScope() {
        exitScope(null);
    }

    /**
     * Decrement the reference count and stop the client when leaving the outermost scope.
     * <p>
     * If the scope is left because of a {@link SessionClosedException} and a client still
     * exists afterwards, the client is restarted. The failure itself is left to the caller
     * to propagate; a failed restart is attached to it as suppressed.
     *
     * @param failure what ended the scope, or {@code null} on normal exit
     */
    public void exitScope(Throwable failure) {
        ScopeState state = SCOPE_STATE.get();
        state.mutex.lock();
        try {
            if (state.referenceCount <= 0) {
                throw new ConnectionScopeException("Calling exitScope before enterScope.");
            }
            state.referenceCount--;
            log.debug("Exited connection scope - thread: {}, depth: {}",
                Thread.currentThread().getId(), state.referenceCount);

            if (state.referenceCount == 0 && state.client != null) {
                stopClient(state);
            }

            if (failure instanceof SessionClosedException && state.client != null) {
                restartClient(state, failure);
            }
        } finally {
            state.mutex.unlock();
            if (state.referenceCount == 0 && state.client == null) {
                SCOPE_STATE.remove();
            }
        }
    }

    /**
     * Return the thread's connected client, creating and starting it on first use.
     *
     * @throws ConnectionScopeException if no scope is open on the current thread
     */
    public CoordinationClient getClient() {
        ScopeState state = SCOPE_STATE.get();
        state.mutex.lock();
        try {
            if (state.referenceCount <= 0) {
                throw new ConnectionScopeException(
                    "Use the ConnectionManager inside a connection scope (enterScope/exitScope or callInScope).");
            }
            if (state.client == null) {
                state.client = startClient();
            }
            return state.client;
        } finally {
            state.mutex.unlock();
        }
    }

    public boolean isManaged() {
        return SCOPE_STATE.get().referenceCount > 0;
    }

    public boolean hasClient() {
        return SCOPE_STATE.get().client != null;
    }

    public int getScopeDepth() {
        return SCOPE_STATE.get().referenceCount;
    }

    /**
     * Run the action inside a connection scope
     */
    public <T> T callInScope(CheckedSupplier<T> action) throws Exception {
        enterScope();
        T result;
        try {
            result = action.get();
        } catch (Throwable t) {
            exitAfterFailure(t);
            throw t;
        }
        exitScope();
        return result;
    }

    public void runInScope(CheckedRunnable action) throws Exception {
        callInScope(() -> {
            action.run();
            return null;
        });
    }

    /**
     * Exit a scope that ended with {@code failure}, keeping {@code failure} as the primary error
     */
    public void exitAfterFailure(Throwable failure) {
        try {
            exitScope(failure);
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Drop whatever the current thread holds regardless of nesting.
     * Used at request boundaries to recover from scopes that were never exited.
     *
     * @return true if there was anything to drop
     */
    public boolean discardCurrentThread() {
        ScopeState state = SCOPE_STATE.get();
        state.mutex.lock();
        try {
            boolean hadState = state.referenceCount > 0 || state.client != null;
            if (state.client != null) {
                stopClient(state);
            }
            state.referenceCount = 0;
            return hadState;
        } finally {
            state.mutex.unlock();
            SCOPE_STATE.remove();
        }
    }

    private CoordinationClient startClient() {
        CoordinationClient client = clientFactory.create();
        try {
            client.start();
        } catch (RuntimeException e) {
            try {
                client.stop();
            } catch (RuntimeException stopFailure) {
                e.addSuppressed(stopFailure);
            }
            throw e;
        }
        if (metrics != null) {
            metrics.recordConnectionOpened();
        }
        log.info("Coordination client started - thread: {}", Thread.currentThread().getId());
        return client;
    }

    private void stopClient(ScopeState state) {
        try {
            state.client.stop();
            log.info("Coordination client stopped - thread: {}", Thread.currentThread().getId());
        } finally {
            state.client = null;
            if (metrics != null) {
                metrics.recordConnectionClosed();
            }
        }
    }

    private void restartClient(ScopeState state, Throwable failure) {
        log.warn("Session closed while in connection scope - restarting client - thread: {}",
            Thread.currentThread().getId());
        try {
            state.client.restart();
            if (metrics != null) {
                metrics.recordReconnect();
            }
        } catch (RuntimeException e) {
            log.error("Failed to restart coordination client", e);
            failure.addSuppressed(e);
        }
    }

    private static class ScopeState {
        private final ReentrantLock mutex = new ReentrantLock();
        private int referenceCount;
        private CoordinationClient client;
    }
}
