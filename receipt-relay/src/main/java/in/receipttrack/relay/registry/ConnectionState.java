package in.receipttrack.relay.registry;

/**
 * Lifecycle of a client connection. Transitions only move forward.
 */
public enum ConnectionState {
    OPEN,
    CLOSING,
    CLOSED
}
