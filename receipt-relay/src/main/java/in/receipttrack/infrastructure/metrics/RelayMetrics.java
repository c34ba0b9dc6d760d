package in.receipttrack.infrastructure.metrics;

import java.time.Duration;

/**
 * Relay metrics for monitoring and alerting.
 *
 * Key metrics:
 * - Open connections and connection churn
 * - Broadcast fan-out size and per-connection delivery failures
 * - Channel message outcomes (broadcast, malformed, nacked)
 * - Subscription failures
 * - Publisher success/failure
 */
public interface RelayMetrics {

    void recordConnectionOpened();

    /**
     * @param reason why the connection ended (peer_closed, keepalive_timeout, write_failed, shutdown, ...)
     */
    void recordConnectionClosed(String reason);

    /**
     * @param reason why the connection was refused (registry_full, closed_early)
     */
    void recordConnectionRejected(String reason);

    /**
     * Record one fan-out.
     *
     * @param recipients connections in the snapshot
     * @param failures   connections the payload could not be handed to
     * @param latency    time spent in the fan-out
     */
    void recordBroadcast(int recipients, int failures, Duration latency);

    /**
     * @param reason queue_full, not_open or error
     */
    void recordDeliveryFailure(String reason);

    /**
     * @param outcome broadcast, malformed or nacked
     */
    void recordChannelMessage(String outcome);

    void recordSubscriptionFailure();

    void recordPublish(boolean success);
}
