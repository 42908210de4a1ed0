package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockTimeoutException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockedException;
import id.go.kemenkeu.djpbn.sakti.zk.core.wrapper.CheckedSupplier;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LockResultsTest {

    @Test
    @DisplayName("Should return the action's result when not locked")
    void testPassThrough() throws Exception {
        CheckedSupplier<String> task = LockResults.returnWhenLocked("Locked", () -> "done");

        assertEquals("done", task.get());
    }

    @Test
    @DisplayName("Should return the substitute when locked")
    void testSubstitute() throws Exception {
        CheckedSupplier<String> task = LockResults.returnWhenLocked("Locked", () -> {
            throw new LockedException("res-1");
        });

        assertEquals("Locked", task.get());
    }

    @Test
    @DisplayName("Should allow a null substitute")
    void testNullSubstitute() throws Exception {
        assertNull(LockResults.callReturningWhenLocked(null, () -> {
            throw new LockedException("res-1");
        }));
    }

    @Test
    @DisplayName("Should not hide timeouts")
    void testTimeoutPropagates() {
        CheckedSupplier<String> task = LockResults.returnWhenLocked("Locked", () -> {
            throw new LockTimeoutException("res-1", null);
        });

        assertThrows(LockTimeoutException.class, task::get);
    }
}
