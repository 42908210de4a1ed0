package id.go.kemenkeu.djpbn.sakti.zk.starter.health;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.ConnectionManager;
import id.go.kemenkeu.djpbn.sakti.zk.starter.config.SaktiZkProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.function.LongSupplier;

/**
 * Reports whether the coordination service is reachable.
 * <p>
 * When the calling thread already has a client (inside a request scope) its state is
 * reported directly. Otherwise the check opens a session of its own, which blocks for
 * up to {@code sakti.zk.connect-timeout-ms}; that result is kept for
 * {@code sakti.zk.health.cache-ttl-ms} so frequent polling does not open a session
 * per call.
 */
public class ZookeeperHealthIndicator implements HealthIndicator {

    private static final Logger log = LoggerFactory.getLogger(ZookeeperHealthIndicator.class);

    private final ConnectionManager connectionManager;
    private final SaktiZkProperties properties;
    private final LongSupplier clock;

    private volatile CachedHealth cached;

    public ZookeeperHealthIndicator(ConnectionManager connectionManager, SaktiZkProperties properties) {
        this(connectionManager, properties, System::currentTimeMillis);
    }

    ZookeeperHealthIndicator(ConnectionManager connectionManager, SaktiZkProperties properties, LongSupplier clock) {
        this.connectionManager = connectionManager;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public Health health() {
        if (!properties.isCoordinationConfigured()) {
            return Health.unknown()
                .withDetail("status", "disabled")
                .withDetail("message", "No ZooKeeper hosts configured")
                .build();
        }

        if (connectionManager.hasClient()) {
            return withSettings(connectionManager.getClient().isConnected() ? Health.up() : Health.down())
                .withDetail("session", "current")
                .build();
        }

        long now = clock.getAsLong();
        CachedHealth last = cached;
        if (last != null && now - last.checkedAt < properties.getHealth().getCacheTtlMs()) {
            return last.health;
        }

        Health health = checkWithOwnSession(now);
        cached = new CachedHealth(health, now);
        return health;
    }

    private Health checkWithOwnSession(long startedAt) {
        try {
            boolean connected = connectionManager.callInScope(() -> connectionManager.getClient().isConnected());
            return withSettings(connected ? Health.up() : Health.down())
                .withDetail("session", "opened")
                .withDetail("connectMs", clock.getAsLong() - startedAt)
                .build();
        } catch (Exception e) {
            log.error("ZooKeeper health check failed: {}", e.getMessage());
            return Health.down(e)
                .withDetail("hosts", String.join(",", properties.getHosts()))
                .build();
        }
    }

    private Health.Builder withSettings(Health.Builder builder) {
        return builder
            .withDetail("mode", properties.getClientMode().name())
            .withDetail("hosts", String.join(",", properties.getHosts()))
            .withDetail("namespace", properties.getNamespace());
    }

    private static final class CachedHealth {
        private final Health health;
        private final long checkedAt;

        CachedHealth(Health health, long checkedAt) {
            this.health = health;
            this.checkedAt = checkedAt;
        }
    }
}
