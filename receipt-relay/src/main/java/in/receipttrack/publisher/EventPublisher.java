package in.receipttrack.publisher;

import in.receipttrack.domain.event.ReceiptEvent;
import in.receipttrack.domain.event.ReceiptEventDraft;

/**
 * Entry point for producers (upload API, processing pipeline) to announce a receipt
 * lifecycle change.
 *
 * The submission time is always stamped here, never taken from the caller.
 * Success means the channel accepted the message, not that any client received it.
 */
public interface EventPublisher {

    /**
     * @return the published event, including the stamped submission time
     * @throws PublishException if the channel is unreachable or rejects the message
     */
    ReceiptEvent submit(String projectId, String topicId, ReceiptEventDraft draft) throws PublishException;
}
