package in.receipttrack.relay.channel;

/**
 * Failure talking to the publish/subscribe channel: connect, subscribe, fetch,
 * publish or acknowledge.
 */
public class ChannelException extends Exception {

    public ChannelException(String message) {
        super(message);
    }

    public ChannelException(String message, Throwable cause) {
        super(message, cause);
    }
}
