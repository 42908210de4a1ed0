package id.go.kemenkeu.djpbn.sakti.zk.starter.config;

import id.go.kemenkeu.djpbn.sakti.zk.core.connection.CoordinationSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "sakti.zk")
public class SaktiZkProperties {

    private List<String> hosts = new ArrayList<>();
    private String namespace = CoordinationSettings.DEFAULT_NAMESPACE;
    private ClientMode clientMode = ClientMode.CURATOR;
    private int connectTimeoutMs = 15000;
    private int sessionTimeoutMs = 60000;
    private Retry retry = new Retry();
    private Lock lock = new Lock();
    private Web web = new Web();
    private Migration migration = new Migration();
    private Health health = new Health();

    public enum ClientMode {
        CURATOR,
        IN_MEMORY
    }

    public static class Retry {
        private int baseSleepMs = 1000;
        private int maxRetries = 3;

        public int getBaseSleepMs() { return baseSleepMs; }
        public void setBaseSleepMs(int baseSleepMs) { this.baseSleepMs = baseSleepMs; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    }

    public static class Lock {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Web {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class Migration {
        private boolean enabled = true;
        private String lockKey = "migrations";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getLockKey() { return lockKey; }
        public void setLockKey(String lockKey) { this.lockKey = lockKey; }
    }

    public static class Health {
        private boolean enabled = true;
        /** How long a result that needed its own session is reused; 0 checks every time */
        private long cacheTtlMs = 30000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getCacheTtlMs() { return cacheTtlMs; }
        public void setCacheTtlMs(long cacheTtlMs) { this.cacheTtlMs = cacheTtlMs; }
    }

    /**
     * Whether locks can be coordinated at all: hosts are configured or the in-memory client is used
     */
    public boolean isCoordinationConfigured() {
        return clientMode == ClientMode.IN_MEMORY || (hosts != null && !hosts.isEmpty());
    }

    public CoordinationSettings toSettings() {
        return new CoordinationSettings(hosts, namespace,
            Duration.ofMillis(connectTimeoutMs), Duration.ofMillis(sessionTimeoutMs),
            retry.getBaseSleepMs(), retry.getMaxRetries());
    }

    public List<String> getHosts() { return hosts; }
    public void setHosts(List<String> hosts) { this.hosts = hosts; }
    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }
    public ClientMode getClientMode() { return clientMode; }
    public void setClientMode(ClientMode clientMode) { this.clientMode = clientMode; }
    public int getConnectTimeoutMs() { return connectTimeoutMs; }
    public void setConnectTimeoutMs(int connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    public int getSessionTimeoutMs() { return sessionTimeoutMs; }
    public void setSessionTimeoutMs(int sessionTimeoutMs) { this.sessionTimeoutMs = sessionTimeoutMs; }
    public Retry getRetry() { return retry; }
    public void setRetry(Retry retry) { this.retry = retry; }
    public Lock getLock() { return lock; }
    public void setLock(Lock lock) { this.lock = lock; }
    public Web getWeb() { return web; }
    public void setWeb(Web web) { this.web = web; }
    public Migration getMigration() { return migration; }
    public void setMigration(Migration migration) { this.migration = migration; }
    public Health getHealth() { return health; }
    public void setHealth(Health health) { this.health = health; }
}
