package in.receipttrack.relay.broadcast;

import in.receipttrack.domain.event.ReceiptEvent;
import in.receipttrack.infrastructure.metrics.RelayMetrics;
import in.receipttrack.relay.codec.ReceiptEventCodec;
import in.receipttrack.relay.registry.ClientConnection;
import in.receipttrack.relay.registry.ConnectionRegistry;
import in.receipttrack.relay.registry.ConnectionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * Fans one receipt event out to every connection in a registry snapshot.
 *
 * Each hand-off is a non-blocking enqueue into the connection's bounded outbound
 * queue. A connection that cannot take the payload (queue full, already closing,
 * unexpected error) is asked to close and is removed from the registry before
 * {@link #broadcast} returns. Nothing a single peer does can fail or stall the call.
 *
 * Every event goes to every connection; {@code user_uid} in the payload lets clients
 * filter for themselves.
 */
public final class Broadcaster {
    private static final Logger log = LoggerFactory.getLogger(Broadcaster.class);

    private final ConnectionRegistry registry;
    private final ReceiptEventCodec codec;
    private final RelayMetrics metrics;

    public Broadcaster(ConnectionRegistry registry, ReceiptEventCodec codec, RelayMetrics metrics) {
        this.registry = registry;
        this.codec = codec;
        this.metrics = metrics;
    }

    public BroadcastResult broadcast(ReceiptEvent event) {
        long start = System.nanoTime();
        String payload = codec.encode(event);

        List<ClientConnection> recipients = registry.snapshot();
        if (recipients.isEmpty()) {
            log.debug("[RELAY] No connected clients for receipt={} status={}",
                event.subjectId(), event.status().wireName());
            metrics.recordBroadcast(0, 0, Duration.ofNanos(System.nanoTime() - start));
            return BroadcastResult.empty();
        }

        int delivered = 0;
        int failed = 0;
        for (ClientConnection connection : recipients) {
            if (deliver(connection, payload)) {
                delivered++;
            } else {
                failed++;
            }
        }

        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        metrics.recordBroadcast(recipients.size(), failed, elapsed);

        if (failed > 0) {
            log.warn("[RELAY] Broadcast receipt={} status={} delivered={} failed={}",
                event.subjectId(), event.status().wireName(), delivered, failed);
        } else {
            log.debug("[RELAY] Broadcast receipt={} status={} delivered={} in {}us",
                event.subjectId(), event.status().wireName(), delivered, elapsed.toNanos() / 1000);
        }
        return new BroadcastResult(recipients.size(), delivered, failed);
    }

    private boolean deliver(ClientConnection connection, String payload) {
        String failure;
        try {
            if (connection.offer(payload)) {
                return true;
            }
            failure = connection.state() == ConnectionState.OPEN ? "queue_full" : "not_open";
        } catch (RuntimeException e) {
            log.warn("[RELAY] Delivery to connection {} threw", connection.connectionId(), e);
            failure = "error";
        }

        metrics.recordDeliveryFailure(failure);
        log.info("[RELAY] Dropping connection {} ({})", connection.connectionId(), failure);
        disconnect(connection, failure);
        return false;
    }

    private void disconnect(ClientConnection connection, String reason) {
        try {
            connection.requestClose("delivery failed: " + reason);
        } catch (RuntimeException e) {
            log.warn("[RELAY] Close request failed for connection {}", connection.connectionId(), e);
        } finally {
            registry.unregister(connection.connectionId());
        }
    }
}
