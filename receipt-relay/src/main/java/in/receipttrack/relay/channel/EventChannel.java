package in.receipttrack.relay.channel;

/**
 * Publish/subscribe transport between event producers and the relay.
 *
 * Delivery is at-least-once and unordered. Implementations are thread-safe:
 * publishers and the listener share one instance.
 */
public interface EventChannel extends AutoCloseable {

    /**
     * Open (or resume) a named subscription on a topic.
     *
     * @param subscriptionName durable name; consumers sharing it share the message flow
     */
    ChannelSubscription subscribe(ChannelAddress address, String subscriptionName) throws ChannelException;

    /**
     * Publish a payload and wait for the channel to accept it.
     *
     * @return the channel-assigned message id
     */
    String publish(ChannelAddress address, byte[] payload) throws ChannelException;

    @Override
    void close();
}
