package in.receipttrack.domain.event;

import java.util.Objects;

/**
 * Event as supplied by a producer. The submission time is never part of it;
 * the publisher stamps it.
 */
public record ReceiptEventDraft(
    EventKind kind,
    EventStatus status,
    String subjectId,
    String ownerId
) {
    public ReceiptEventDraft {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(subjectId, "subjectId");
        Objects.requireNonNull(ownerId, "ownerId");
        if (subjectId.isBlank() || ownerId.isBlank()) {
            throw new IllegalArgumentException("subjectId and ownerId must not be blank");
        }
    }
}
