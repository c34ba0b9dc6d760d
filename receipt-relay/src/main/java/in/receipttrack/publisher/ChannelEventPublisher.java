package in.receipttrack.publisher;

import in.receipttrack.domain.event.ReceiptEvent;
import in.receipttrack.domain.event.ReceiptEventDraft;
import in.receipttrack.infrastructure.metrics.RelayMetrics;
import in.receipttrack.relay.channel.ChannelAddress;
import in.receipttrack.relay.channel.ChannelException;
import in.receipttrack.relay.channel.EventChannel;
import in.receipttrack.relay.codec.ReceiptEventCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * {@link EventPublisher} that stamps the event, encodes it with the relay's wire codec
 * and publishes it on an {@link EventChannel}. Thread-safe.
 */
public final class ChannelEventPublisher implements EventPublisher {
    private static final Logger log = LoggerFactory.getLogger(ChannelEventPublisher.class);

    private final EventChannel channel;
    private final ReceiptEventCodec codec;
    private final RelayMetrics metrics;
    private final Clock clock;

    public ChannelEventPublisher(EventChannel channel, ReceiptEventCodec codec, RelayMetrics metrics, Clock clock) {
        this.channel = channel;
        this.codec = codec;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public ReceiptEvent submit(String projectId, String topicId, ReceiptEventDraft draft) throws PublishException {
        ChannelAddress address = new ChannelAddress(projectId, topicId);
        ReceiptEvent event = ReceiptEvent.from(draft, clock.instant());

        try {
            String messageId = channel.publish(address, codec.encodeBytes(event));
            metrics.recordPublish(true);
            log.info("[PUBLISH] {} {} receipt={} user={} -> {} (id={})",
                event.kind().wireName(), event.status().wireName(), event.subjectId(), event.ownerId(),
                address, messageId);
            return event;
        } catch (ChannelException | RuntimeException e) {
            metrics.recordPublish(false);
            log.warn("[PUBLISH] Failed to publish receipt={} to {}: {}", event.subjectId(), address, e.toString());
            throw new PublishException("Failed to publish to " + address, e);
        }
    }
}
