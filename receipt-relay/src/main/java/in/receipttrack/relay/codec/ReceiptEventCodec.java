package in.receipttrack.relay.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.receipttrack.domain.event.EventKind;
import in.receipttrack.domain.event.EventStatus;
import in.receipttrack.domain.event.ReceiptEvent;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * JSON wire format shared by the publisher and the relay.
 *
 * Example:
 * <pre>
 * {"type":"receipt_update","status":"processed","receipt_id":"abc123","user_uid":"u1","timestamp":"2024-05-01T10:15:30Z"}
 * </pre>
 *
 * Field names are a compatibility contract with deployed clients. Unknown inbound
 * fields (e.g. a free-text {@code message}) are ignored and never forwarded.
 */
public final class ReceiptEventCodec {
    public static final String FIELD_TYPE = "type";
    public static final String FIELD_STATUS = "status";
    public static final String FIELD_RECEIPT_ID = "receipt_id";
    public static final String FIELD_USER_UID = "user_uid";
    public static final String FIELD_TIMESTAMP = "timestamp";

    public static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'").withZone(ZoneOffset.UTC);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Clock clock;

    public ReceiptEventCodec() {
        this(Clock.systemUTC());
    }

    /**
     * @param clock used to stamp inbound payloads that arrive without a timestamp
     */
    public ReceiptEventCodec(Clock clock) {
        this.clock = clock;
    }

    public String encode(ReceiptEvent event) {
        ObjectNode o = MAPPER.createObjectNode();
        o.put(FIELD_TYPE, event.kind().wireName());
        o.put(FIELD_STATUS, event.status().wireName());
        o.put(FIELD_RECEIPT_ID, event.subjectId());
        o.put(FIELD_USER_UID, event.ownerId());
        o.put(FIELD_TIMESTAMP, TIMESTAMP_FORMAT.format(event.occurredAt()));
        try {
            return MAPPER.writeValueAsString(o);
        } catch (JsonProcessingException e) {
            // Only string fields; Jackson cannot fail here short of a bug.
            throw new IllegalStateException("Failed to serialize receipt event", e);
        }
    }

    public byte[] encodeBytes(ReceiptEvent event) {
        return encode(event).getBytes(StandardCharsets.UTF_8);
    }

    public ReceiptEvent decode(byte[] payload) throws EventDecodingException {
        if (payload == null || payload.length == 0) {
            throw new EventDecodingException("Empty payload");
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new EventDecodingException("Payload is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new EventDecodingException("Payload could not be read: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new EventDecodingException("Payload is not a JSON object");
        }

        EventKind kind;
        EventStatus status;
        try {
            kind = EventKind.fromWire(requireText(root, FIELD_TYPE));
            status = EventStatus.fromWire(requireText(root, FIELD_STATUS));
        } catch (IllegalArgumentException e) {
            throw new EventDecodingException(e.getMessage(), e);
        }

        String receiptId = requireText(root, FIELD_RECEIPT_ID);
        String userUid = requireText(root, FIELD_USER_UID);

        return new ReceiptEvent(kind, status, receiptId, userUid, readTimestamp(root));
    }

    private Instant readTimestamp(JsonNode root) throws EventDecodingException {
        JsonNode node = root.get(FIELD_TIMESTAMP);
        if (node == null || node.isNull()) {
            // Producers that predate submission-time stamping omit the field.
            return clock.instant();
        }
        if (!node.isTextual()) {
            throw new EventDecodingException("Field '" + FIELD_TIMESTAMP + "' must be a string");
        }
        try {
            return TIMESTAMP_FORMAT.parse(node.asText(), Instant::from);
        } catch (DateTimeParseException e) {
            throw new EventDecodingException("Malformed timestamp: " + node.asText(), e);
        }
    }

    private static String requireText(JsonNode root, String field) throws EventDecodingException {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            throw new EventDecodingException("Missing required field '" + field + "'");
        }
        if (!node.isTextual() || node.asText().isBlank()) {
            throw new EventDecodingException("Field '" + field + "' must be a non-blank string");
        }
        return node.asText();
    }
}
