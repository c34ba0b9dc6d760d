package in.receipttrack.domain.event;

import java.util.Locale;

/**
 * Processing status carried by a receipt event.
 */
public enum EventStatus {
    RECEIVED,
    PROCESSING_STARTED,
    PROCESSED,
    FAILED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventStatus fromWire(String tag) {
        for (EventStatus status : values()) {
            if (status.wireName().equals(tag)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown event status: " + tag);
    }
}
