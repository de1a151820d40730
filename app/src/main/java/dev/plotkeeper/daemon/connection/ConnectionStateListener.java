package dev.plotkeeper.daemon.connection;

/** Observes a {@link ConnectionSupervisor}. Callbacks run on the event loop and must not block. */
public interface ConnectionStateListener {
    void onStateChanged(ConnectionState previous, ConnectionState current);

    /**
     * Called once when consecutive failed attempts reach the trouble threshold, and again only
     * after a successful connection has reset the count.
     */
    default void onConnectionTrouble(int consecutiveFailures, Throwable lastFailure) {}
}
