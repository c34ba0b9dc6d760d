package in.receipttrack.domain.event;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * One receipt lifecycle update, relayed unchanged from the channel to every connected client.
 *
 * @param kind       what happened to the receipt
 * @param status     processing status
 * @param subjectId  receipt identifier ({@code receipt_id} on the wire)
 * @param ownerId    user the receipt belongs to ({@code user_uid} on the wire); advisory only
 * @param occurredAt submission time, second precision, UTC
 */
public record ReceiptEvent(
    EventKind kind,
    EventStatus status,
    String subjectId,
    String ownerId,
    Instant occurredAt
) {
    public ReceiptEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(occurredAt, "occurredAt");
        subjectId = requireText(subjectId, "subjectId");
        ownerId = requireText(ownerId, "ownerId");
        occurredAt = occurredAt.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Complete a draft with the time it was submitted.
     */
    public static ReceiptEvent from(ReceiptEventDraft draft, Instant occurredAt) {
        return new ReceiptEvent(draft.kind(), draft.status(), draft.subjectId(), draft.ownerId(), occurredAt);
    }

    private static String requireText(String value, String field) {
        Objects.requireNonNull(value, field);
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
        return value;
    }
}
