package in.receipttrack.relay.broadcast;

/**
 * Outcome of one fan-out.
 *
 * @param attempted connections in the snapshot
 * @param delivered connections that accepted the payload into their outbound queue
 * @param failed    connections that could not, and were disconnected
 */
public record BroadcastResult(int attempted, int delivered, int failed) {

    public static BroadcastResult empty() {
        return new BroadcastResult(0, 0, 0);
    }
}
