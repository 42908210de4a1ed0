package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockedException;
import id.go.kemenkeu.djpbn.sakti.zk.core.wrapper.CheckedSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * "Skip if busy" adapters for guarded operations.
 * <pre>{@code
 * CheckedSupplier<String> task = LockResults.returnWhenLocked("already locked",
 *     () -> lock.execute(LockOptions.nonBlocking(), () -> "done"));
 * }</pre>
 * Only {@link LockedException} is replaced; timeouts and every other failure propagate.
 */
public final class LockResults {

    private static final Logger log = LoggerFactory.getLogger(LockResults.class);

    private LockResults() {
    }

    public static <T> CheckedSupplier<T> returnWhenLocked(T substitute, CheckedSupplier<T> action) {
        return () -> callReturningWhenLocked(substitute, action);
    }

    public static <T> T callReturningWhenLocked(T substitute, CheckedSupplier<T> action) throws Exception {
        try {
            return action.get();
        } catch (LockedException e) {
            log.debug("Returning substitute value - {}", e.getMessage());
            return substitute;
        }
    }
}
