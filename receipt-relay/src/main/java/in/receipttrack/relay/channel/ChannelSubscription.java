package in.receipttrack.relay.channel;

import java.time.Duration;
import java.util.List;

/**
 * Provider-managed subscription handle, pulled by a single consumer thread.
 */
public interface ChannelSubscription extends AutoCloseable {

    /**
     * Wait up to {@code maxWait} for messages.
     *
     * @return up to {@code maxMessages} messages, empty if none arrived in time
     * @throws ChannelException if the subscription is broken and must be re-created
     */
    List<InboundMessage> fetch(int maxMessages, Duration maxWait) throws ChannelException, InterruptedException;

    @Override
    void close();
}
