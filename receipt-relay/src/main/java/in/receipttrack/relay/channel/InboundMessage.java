package in.receipttrack.relay.channel;

/**
 * One delivery of a channel message. Must be acknowledged or negatively
 * acknowledged exactly once.
 */
public interface InboundMessage {

    /**
     * Channel-assigned identifier; stable across redeliveries.
     */
    String messageId();

    /**
     * 1 for the first delivery, incremented on every redelivery.
     */
    int deliveryAttempt();

    byte[] data();

    /**
     * Consumed; the channel will not redeliver it.
     */
    void ack() throws ChannelException;

    /**
     * Not consumed; the channel should redeliver it.
     */
    void nak() throws ChannelException;
}
