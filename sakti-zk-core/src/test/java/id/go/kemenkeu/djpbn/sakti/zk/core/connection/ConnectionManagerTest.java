package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

import id.go.kemenkeu.djpbn.sakti.zk.core.exception.ConnectionScopeException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.LockConfigurationException;
import id.go.kemenkeu.djpbn.sakti.zk.core.exception.SessionClosedException;
import id.go.kemenkeu.djpbn.sakti.zk.core.metrics.LockMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ConnectionManagerTest {

    private FakeCoordinationClientFactory factory;
    private LockMetrics metrics;
    private ConnectionManager connectionManager;

    @BeforeEach
    void setUp() {
        factory = new FakeCoordinationClientFactory();
        metrics = new LockMetrics();
        connectionManager = new ConnectionManager(factory, metrics);
    }

    @AfterEach
    void tearDown() {
        connectionManager.discardCurrentThread();
    }

    @Nested
    @DisplayName("Scopes")
    class ScopeTests {

        @Test
        @DisplayName("Should refuse to hand out a client outside a scope")
        void testClientOutsideScope() {
            assertThrows(ConnectionScopeException.class, () -> connectionManager.getClient());
            assertTrue(factory.getCreated().isEmpty());
        }

        @Test
        @DisplayName("Should reject exit without enter")
        void testExitWithoutEnter() {
            ConnectionScopeException e = assertThrows(ConnectionScopeException.class,
                () -> connectionManager.exitScope());
            assertEquals("Calling exitScope before enterScope.", e.getMessage());
            assertTrue(e instanceof LockConfigurationException);
        }

        @Test
        @DisplayName("Should create the client lazily")
        void testLazyClient() {
            connectionManager.enterScope();
            assertTrue(connectionManager.isManaged());
            assertFalse(connectionManager.hasClient());
            assertTrue(factory.getCreated().isEmpty());

            connectionManager.getClient();

            assertEquals(1, factory.getCreated().size());
            assertTrue(factory.last().isStarted());
            connectionManager.exitScope();
        }

        @Test
        @DisplayName("Should share one client between nested scopes")
        void testNestedScopesShareClient() {
            connectionManager.enterScope();
            CoordinationClient outer = connectionManager.getClient();
            connectionManager.enterScope();
            CoordinationClient inner = connectionManager.getClient();

            assertSame(outer, inner);
            assertEquals(2, connectionManager.getScopeDepth());
            assertEquals(1, factory.last().getStarts());

            connectionManager.exitScope();
            assertTrue(connectionManager.hasClient());
            assertEquals(0, factory.last().getStops());

            connectionManager.exitScope();
            assertFalse(connectionManager.hasClient());
            assertFalse(connectionManager.isManaged());
            assertEquals(1, factory.last().getStops());
        }

        @Test
        @DisplayName("Should share thread state between manager instances")
        void testManagersShareThreadState() {
            ConnectionManager other = new ConnectionManager(new FakeCoordinationClientFactory());

            connectionManager.enterScope();
            CoordinationClient client = connectionManager.getClient();

            assertTrue(other.isManaged());
            assertSame(client, other.getClient());
            connectionManager.exitScope();
            assertFalse(other.isManaged());
        }

        @Test
        @DisplayName("Should keep state per thread")
        void testStatePerThread() throws Exception {
            connectionManager.enterScope();
            connectionManager.getClient();

            boolean managedElsewhere = CompletableFuture
                .supplyAsync(() -> connectionManager.isManaged())
                .get(5, TimeUnit.SECONDS);

            assertFalse(managedElsewhere);
            connectionManager.exitScope();
        }

        @Test
        @DisplayName("Should open a new client after the outermost scope closed")
        void testNewClientPerOutermostScope() throws Exception {
            CoordinationClient first = connectionManager.callInScope(connectionManager::getClient);
            CoordinationClient second = connectionManager.callInScope(connectionManager::getClient);

            assertNotSame(first, second);
            assertEquals(2, factory.getCreated().size());
            assertEquals(2, metrics.getConnectionsOpened());
            assertEquals(2, metrics.getConnectionsClosed());
            assertEquals(0, metrics.getOpenConnections());
        }
    }

    @Nested
    @DisplayName("Session closed recovery")
    class RestartTests {

        @Test
        @DisplayName("Single scope with client: client is stopped, not restarted")
        void testSingleScopeWithClient() {
            connectionManager.enterScope();
            connectionManager.getClient();

            connectionManager.exitScope(new SessionClosedException("expired"));

            FakeCoordinationClient client = factory.last();
            assertEquals(0, client.getRestarts());
            assertEquals(1, client.getStops());
            assertFalse(connectionManager.isManaged());
        }

        @Test
        @DisplayName("Nested scopes without client: nothing to restart")
        void testNestedScopesWithoutClient() {
            connectionManager.enterScope();
            connectionManager.enterScope();

            connectionManager.exitScope(new SessionClosedException("expired"));
            connectionManager.exitScope();

            assertTrue(factory.getCreated().isEmpty());
        }

        @Test
        @DisplayName("Nested scopes with client created inside: restarted once")
        void testNestedScopesWithClient() {
            connectionManager.enterScope();
            connectionManager.enterScope();
            connectionManager.getClient();

            connectionManager.exitScope(new SessionClosedException("expired"));

            FakeCoordinationClient client = factory.last();
            assertEquals(1, client.getRestarts());
            assertEquals(0, client.getStops());
            assertEquals(1, metrics.getReconnects());

            connectionManager.exitScope();
            assertEquals(1, client.getRestarts());
            assertEquals(1, client.getStops());
        }

        @Test
        @DisplayName("Other failures do not restart the client")
        void testOtherFailureNoRestart() {
            connectionManager.enterScope();
            connectionManager.enterScope();
            connectionManager.getClient();

            connectionManager.exitScope(new IllegalStateException("boom"));

            assertEquals(0, factory.last().getRestarts());
            connectionManager.exitScope();
        }

        @Test
        @DisplayName("Failed restart is attached to the original failure")
        void testRestartFailureSuppressed() {
            RuntimeException restartFailure = new RuntimeException("still down");
            factory.customize(client -> client.failRestartWith(restartFailure));
            SessionClosedException failure = new SessionClosedException("expired");

            connectionManager.enterScope();
            connectionManager.enterScope();
            connectionManager.getClient();
            connectionManager.exitScope(failure);

            assertEquals(1, failure.getSuppressed().length);
            assertSame(restartFailure, failure.getSuppressed()[0]);
            connectionManager.exitScope();
        }
    }

    @Nested
    @DisplayName("Helpers")
    class HelperTests {

        @Test
        @DisplayName("Should exit the scope when the action fails")
        void testCallInScopeFailure() {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> connectionManager.callInScope(() -> {
                    connectionManager.getClient();
                    throw new IllegalStateException("boom");
                }));

            assertEquals("boom", e.getMessage());
            assertFalse(connectionManager.isManaged());
            assertEquals(1, factory.last().getStops());
        }

        @Test
        @DisplayName("Should stop a client that failed to start")
        void testStartFailure() {
            factory.customize(client -> client.failStartWith(new SessionClosedException("unreachable")));

            connectionManager.enterScope();
            assertThrows(SessionClosedException.class, () -> connectionManager.getClient());

            assertFalse(connectionManager.hasClient());
            assertEquals(1, factory.last().getStops());
            assertEquals(0, metrics.getConnectionsOpened());
            connectionManager.exitScope();
        }

        @Test
        @DisplayName("Should discard leaked scopes")
        void testDiscardCurrentThread() {
            connectionManager.enterScope();
            connectionManager.enterScope();
            connectionManager.getClient();

            assertTrue(connectionManager.discardCurrentThread());

            assertFalse(connectionManager.isManaged());
            assertFalse(connectionManager.hasClient());
            assertEquals(1, factory.last().getStops());
            assertFalse(connectionManager.discardCurrentThread());
        }

        @Test
        @DisplayName("Should reject a null factory")
        void testNullFactory() {
            assertThrows(IllegalArgumentException.class, () -> new ConnectionManager(null));
        }
    }
}
