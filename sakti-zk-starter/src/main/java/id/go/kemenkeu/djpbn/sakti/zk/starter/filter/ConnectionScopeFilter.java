package id.go.kemenkeu.djpbn.sakti.zk.starter.filter;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import jakarta.servlet.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;

import java.io.IOException;

/**
 * Opens a connection scope for every request so that all locks taken while
 * handling it share one client, and closes the client when the response is done.
 * <p>
 * Runs first and finishes last. A request thread that still has a scope on entry
 * leaked it from an earlier request; that state is discarded before continuing.
 */
@Order(Ordered.HIGHEST_PRECEDENCE)
public class ConnectionScopeFilter implements Filter {

    private static final Logger log = LoggerFactory.getLogger(ConnectionScopeFilter.class);

    private final ConnectionManager connectionManager;

    public ConnectionScopeFilter(ConnectionManager connectionManager) {
        this.connectionManager = connectionManager;
    }

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {

        if (connectionManager.isManaged() && connectionManager.discardCurrentThread()) {
            log.warn("Connection scope leak detected before request - cleaned - thread: {} ({})",
                Thread.currentThread().getId(), Thread.currentThread().getName());
        }

        connectionManager.enterScope();
        try {
            chain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException | Error e) {
            connectionManager.exitAfterFailure(e);
            throw e;
        }
        connectionManager.exitScope();
    }
}
