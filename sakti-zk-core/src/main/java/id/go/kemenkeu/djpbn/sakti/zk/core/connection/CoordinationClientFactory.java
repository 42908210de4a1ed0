package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

/**
 * Creates unstarted clients for the connection manager.
 */
@FunctionalInterface
public interface CoordinationClientFactory {
    CoordinationClient create();
}
