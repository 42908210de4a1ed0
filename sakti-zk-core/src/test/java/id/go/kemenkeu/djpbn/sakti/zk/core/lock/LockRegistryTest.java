package id.go.kemenkeu.djpbn.sakti.zk.core.lock;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.DuplicateLockKeyException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LockRegistryTest {

    private final LockRegistry registry = new LockRegistry();

    @Test
    @DisplayName("Should reject the same template twice")
    void testDuplicate() {
        registry.register("res-{id}");

        DuplicateLockKeyException e = assertThrows(DuplicateLockKeyException.class,
            () -> registry.register("res-{id}"));
        assertEquals("Attempt to register the same key twice: res-{id}", e.getMessage());
        assertEquals("res-{id}", e.getKeyTemplate());
        assertTrue(e instanceof LockConfigurationException);
    }

    @Test
    @DisplayName("Should free the template when the registration closes")
    void testRelease() {
        LockRegistration registration = registry.register("res-{id}");
        registration.close();

        assertTrue(registration.isClosed());
        assertFalse(registry.isRegistered("res-{id}"));
        assertDoesNotThrow(() -> registry.register("res-{id}"));
    }

    @Test
    @DisplayName("A stale registration should not free a newer one")
    void testStaleClose() {
        LockRegistration first = registry.register("res");
        first.close();
        registry.register("res");

        first.close();

        assertTrue(registry.isRegistered("res"));
    }

    @Test
    @DisplayName("Should compare templates as exact strings")
    void testExactComparison() {
        registry.register("res-{id}");
        registry.register("res-{key}");

        assertEquals(Set.of("res-{id}", "res-{key}"), registry.getRegisteredKeys());
    }
}
