package in.receipttrack.domain.event;

import java.util.Locale;

/**
 * Kind of receipt lifecycle event.
 */
public enum EventKind {
    RECEIPT_UPLOAD,
    RECEIPT_UPDATE;

    /**
     * Tag used on the wire, e.g. {@code receipt_upload}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolve a wire tag. Matching is exact: {@code RECEIPT_UPLOAD} is not accepted.
     *
     * @throws IllegalArgumentException if the tag is unknown
     */
    public static EventKind fromWire(String tag) {
        for (EventKind kind : values()) {
            if (kind.wireName().equals(tag)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + tag);
    }
}
