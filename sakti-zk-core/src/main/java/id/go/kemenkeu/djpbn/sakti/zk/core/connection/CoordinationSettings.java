package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

import java.time.Duration;
import java.util.List;

/**
 * Static connection settings: hosts, lock namespace and client timeouts.
 */
public class CoordinationSettings {

    public static final String DEFAULT_NAMESPACE = "app";

    private final List<String> hosts;
    private final String namespace;
    private final Duration connectTimeout;
    private final Duration sessionTimeout;
    private final int retryBaseSleepMs;
    private final int retryMaxRetries;

    public CoordinationSettings(List<String> hosts, String namespace, Duration connectTimeout,
                                Duration sessionTimeout, int retryBaseSleepMs, int retryMaxRetries) {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace cannot be empty");
        }
        this.hosts = hosts == null ? List.of() : List.copyOf(hosts);
        this.namespace = namespace;
        this.connectTimeout = connectTimeout;
        this.sessionTimeout = sessionTimeout;
        this.retryBaseSleepMs = retryBaseSleepMs;
        this.retryMaxRetries = retryMaxRetries;
    }

    public static CoordinationSettings of(List<String> hosts, String namespace) {
        return new CoordinationSettings(hosts, namespace, Duration.ofSeconds(15), Duration.ofSeconds(60), 1000, 3);
    }

    public boolean hasHosts() {
        return !hosts.isEmpty();
    }

    /**
     * Hosts joined the way ZooKeeper expects a connect string
     */
    public String getConnectString() {
        return String.join(",", hosts);
    }

    public List<String> getHosts() { return hosts; }
    public String getNamespace() { return namespace; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getSessionTimeout() { return sessionTimeout; }
    public int getRetryBaseSleepMs() { return retryBaseSleepMs; }
    public int getRetryMaxRetries() { return retryMaxRetries; }
}
