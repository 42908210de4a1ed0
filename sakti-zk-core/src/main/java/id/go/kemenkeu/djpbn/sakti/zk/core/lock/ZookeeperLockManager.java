package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import id.go.kemenkeu.djpbn.sakti.zk.core.metrics.LockMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ZookeeperLockManager implements LockManager {
    
    private static final Logger log = LoggerFactory.getLogger(ZookeeperLockManager.class);

    private final ConnectionManager connectionManager;
    private final String namespace;
    private final LockRegistry registry;
    private final LockMetrics metrics;

    public ZookeeperLockManager(ConnectionManager connectionManager, String namespace) {
        this(connectionManager, namespace, LockRegistry.global(), null);
    }

    public ZookeeperLockManager(ConnectionManager connectionManager, String namespace,
                                LockRegistry registry, LockMetrics metrics) {
        if (connectionManager == null) {
            throw new IllegalArgumentException("ConnectionManager cannot be null");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be empty");
        }
        this.connectionManager = connectionManager;
        this.namespace = namespace;
        this.registry = registry == null ? LockRegistry.global() : registry;
        this.metrics = metrics;
    }
    
    @Override
    public DistributedLock createLock(String keyTemplate) {
        KeyTemplate template = KeyTemplate.parse(keyTemplate);
        LockRegistration registration = registry.register(keyTemplate);
        log.debug("Lock created: /locks/{}/{}", namespace, keyTemplate);
        return new DistributedLock(template, registration, connectionManager, namespace, new HeldKeys(), metrics);
    }

    public ConnectionManager getConnectionManager() {
        return connectionManager;
    }

    public String getNamespace() {
        return namespace;
    }

    public LockRegistry getRegistry() {
        return registry;
    }
}
