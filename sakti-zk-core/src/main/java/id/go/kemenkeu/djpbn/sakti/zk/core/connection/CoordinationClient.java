package id.go.kemenkeu.djpbn.sakti.zk.core.connection;

/**
 * Session-oriented client to the coordination service.
 * One instance is owned by one thread's connection scope at a time.
 */
public interface CoordinationClient {

    /**
     * Establish the session, blocking until connected.
     */
    void start();

    void stop();

    /**
     * Drop the current session and establish a new one.
     */
    void restart();

    boolean isConnected();

    RemoteLock createLock(String path);
}
