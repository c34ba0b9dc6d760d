package in.receipttrack.relay.registry;

/**
 * One live peer as seen by the registry and the broadcaster.
 *
 * The underlying socket belongs to the connection's own I/O loop. Callers outside
 * that loop may enqueue payloads and ask for a close, nothing more.
 */
public interface ClientConnection {

    /**
     * Id assigned by {@link ConnectionRegistry#register}, or {@code 0} before registration.
     */
    long connectionId();

    /**
     * Called by the registry, under its lock, when an id is assigned.
     */
    void onRegistered(long connectionId);

    ConnectionState state();

    /**
     * Enqueue a text payload for delivery without blocking.
     *
     * @return false if the outbound queue is full or the connection is no longer open
     */
    boolean offer(String payload);

    /**
     * Ask the owning loop to close the connection. Idempotent and non-blocking.
     */
    void requestClose(String reason);
}
