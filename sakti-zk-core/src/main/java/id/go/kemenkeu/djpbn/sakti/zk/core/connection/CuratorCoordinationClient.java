package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.CoordinationException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.SessionClosedException;
import org.apache.curator.framework.CuratorFramework;
import org.apache.curator.framework.CuratorFrameworkFactory;
import org.apache.curator.framework.recipes.locks.InterProcessSemaphoreMutex;
import org.apache.curator.retry.ExponentialBackoffRetry;
import org.apache.zookeeper.KeeperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * {@link CoordinationClient} backed by an Apache Curator framework instance.
 * <p>
 * Locks are {@link InterProcessSemaphoreMutex}, which is not reentrant: reentrancy
 * is decided by the lock engine before the service is contacted. A closed Curator
 * instance cannot be started again, so {@link #restart()} builds a new one.
 */
public class CuratorCoordinationClient implements CoordinationClient {

    private static final Logger log = LoggerFactory.getLogger(CuratorCoordinationClient.class);

    private final CoordinationSettings settings;
    private volatile CuratorFramework curator;

    public CuratorCoordinationClient(CoordinationSettings settings) {
        if (settings == null || !settings.hasHosts()) {
            throw new IllegalArgumentException("Coordination hosts must be configured");
        }
        this.settings = settings;
    }

    @Override
    public void start() {
        CuratorFramework framework = newFramework();
        framework.start();

        boolean connected;
        try {
            connected = framework.blockUntilConnected(
                (int) settings.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            framework.close();
            throw new CoordinationException("Interrupted while connecting to " + settings.getConnectString(), e);
        }

        if (!connected) {
            framework.close();
            throw new SessionClosedException("Could not connect to " + settings.getConnectString()
                + " within " + settings.getConnectTimeout().toMillis() + "ms");
        }

        curator = framework;
        log.debug("Connected to ZooKeeper: {}", settings.getConnectString());
    }

    @Override
    public void stop() {
        CuratorFramework framework = curator;
        curator = null;
        if (framework != null) {
            framework.close();
            log.debug("Disconnected from ZooKeeper: {}", settings.getConnectString());
        }
    }

    @Override
    public void restart() {
        stop();
        start();
    }

    @Override
    public boolean isConnected() {
        CuratorFramework framework = curator;
        return framework != null && framework.getZookeeperClient().isConnected();
    }

    @Override
    public RemoteLock createLock(String path) {
        CuratorFramework framework = curator;
        if (framework == null) {
            throw new SessionClosedException("Client is not started - cannot create lock " + path);
        }
        return new CuratorRemoteLock(new InterProcessSemaphoreMutex(framework, path), path);
    }

    protected CuratorFramework newFramework() {
        return CuratorFrameworkFactory.builder()
            .connectString(settings.getConnectString())
            .sessionTimeoutMs((int) settings.getSessionTimeout().toMillis())
            .connectionTimeoutMs((int) settings.getConnectTimeout().toMillis())
            .retryPolicy(new ExponentialBackoffRetry(settings.getRetryBaseSleepMs(), settings.getRetryMaxRetries()))
            .build();
    }

    /**
     * Map a Curator/ZooKeeper failure onto the client-neutral exception types
     */
    static RuntimeException translate(String action, String path, Exception e) {
        if (e instanceof KeeperException.SessionExpiredException
                || e instanceof KeeperException.ConnectionLossException
                || e instanceof KeeperException.SessionMovedException) {
            return new SessionClosedException("Session closed while trying to " + action + " " + path, e);
        }
        if (e instanceof IllegalStateException) {
            // Curator reports a closed framework this way
            return new SessionClosedException("Client closed while trying to " + action + " " + path, e);
        }
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            return new CoordinationException("Interrupted while trying to " + action + " " + path, e);
        }
        if (e instanceof CoordinationException) {
            return (CoordinationException) e;
        }
        return new CoordinationException("Failed to " + action + " " + path, e);
    }
}
