package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * How to acquire a lock and which values fill its key placeholders.
 * Immutable; every {@code with*} call returns a copy.
 * <pre>{@code
 * LockOptions.withTimeout(Duration.ofSeconds(10)).param("id", 21)
 * }</pre>
 */
public final class LockOptions {

    private static final LockOptions DEFAULTS = new LockOptions(true, null, Map.of());

    private final boolean blocking;
    private final Duration timeout;
    private final Map<String, Object> params;

    private LockOptions(boolean blocking, Duration timeout, Map<String, Object> params) {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be negative: " + timeout);
        }
        this.blocking = blocking;
        this.timeout = timeout;
        this.params = params;
    }

    /**
     * Block until granted, no timeout
     */
    public static LockOptions defaults() {
        return DEFAULTS;
    }

    /**
     * Fail immediately with {@code LockedException} if the lock is taken
     */
    public static LockOptions nonBlocking() {
        return new LockOptions(false, null, Map.of());
    }

    /**
     * Block for at most {@code timeout}, then fail with {@code LockTimeoutException}
     */
    public static LockOptions withTimeout(Duration timeout) {
        return new LockOptions(true, timeout, Map.of());
    }

    public LockOptions blocking(boolean blocking) {
        return new LockOptions(blocking, timeout, params);
    }

    public LockOptions timeout(Duration timeout) {
        return new LockOptions(blocking, timeout, params);
    }

    public LockOptions param(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(params);
        copy.put(name, value);
        return new LockOptions(blocking, timeout, Collections.unmodifiableMap(copy));
    }

    public LockOptions params(Map<String, ?> values) {
        Map<String, Object> copy = new LinkedHashMap<>(params);
        copy.putAll(values);
        return new LockOptions(blocking, timeout, Collections.unmodifiableMap(copy));
    }

    public boolean isBlocking() { return blocking; }
    public Duration getTimeout() { return timeout; }
    public Map<String, Object> getParams() { return params; }

    @Override
    public String toString() {
        return "LockOptions{blocking=" + blocking + ", timeout=" + timeout + ", params=" + params + "}";
    }
}
