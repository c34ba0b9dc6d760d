package in.receipttrack.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of {@link RelayMetrics}.
 *
 * Key Metrics:
 * - relay_connections_open - Currently open client connections
 * - relay_connections_closed_total{reason} - Closed connections by reason
 * - relay_connections_rejected_total{reason} - Refused connections by reason
 * - relay_broadcasts_total - Fan-outs performed
 * - relay_broadcast_recipients - Recipients per fan-out
 * - relay_broadcast_latency_seconds - Time spent handing one event to all connections
 * - relay_delivery_failures_total{reason} - Per-connection delivery failures
 * - relay_channel_messages_total{outcome} - Inbound channel messages by outcome
 * - relay_subscription_failures_total - Subscribe/fetch failures
 * - relay_publish_total{status} - Publisher submissions
 *
 * Usage:
 * <pre>
 * PrometheusRelayMetrics metrics = new PrometheusRelayMetrics();
 * paths.addExactPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusRelayMetrics implements RelayMetrics {

    private final CollectorRegistry registry;

    private final Gauge connectionsOpen;
    private final Counter connectionsClosed;
    private final Counter connectionsRejected;

    private final Counter broadcasts;
    private final Histogram broadcastRecipients;
    private final Histogram broadcastLatency;
    private final Counter deliveryFailures;

    private final Counter channelMessages;
    private final Counter subscriptionFailures;
    private final Counter publishes;

    public PrometheusRelayMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusRelayMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connectionsOpen = Gauge.build()
            .name("relay_connections_open")
            .help("Currently open client connections")
            .register(registry);

        this.connectionsClosed = Counter.build()
            .name("relay_connections_closed_total")
            .help("Closed client connections")
            .labelNames("reason")
            .register(registry);

        this.connectionsRejected = Counter.build()
            .name("relay_connections_rejected_total")
            .help("Client connections refused after handshake")
            .labelNames("reason")
            .register(registry);

        this.broadcasts = Counter.build()
            .name("relay_broadcasts_total")
            .help("Events fanned out to connected clients")
            .register(registry);

        this.broadcastRecipients = Histogram.build()
            .name("relay_broadcast_recipients")
            .help("Connections in the snapshot of one broadcast")
            .buckets(0, 1, 10, 100, 1000, 10000)
            .register(registry);

        this.broadcastLatency = Histogram.build()
            .name("relay_broadcast_latency_seconds")
            .help("Time spent handing one event to every connection")
            .buckets(0.0001, 0.0005, 0.001, 0.005, 0.01, 0.05, 0.1)
            .register(registry);

        this.deliveryFailures = Counter.build()
            .name("relay_delivery_failures_total")
            .help("Per-connection delivery failures")
            .labelNames("reason")
            .register(registry);

        this.channelMessages = Counter.build()
            .name("relay_channel_messages_total")
            .help("Inbound channel messages by outcome")
            .labelNames("outcome")
            .register(registry);

        this.subscriptionFailures = Counter.build()
            .name("relay_subscription_failures_total")
            .help("Channel subscribe or fetch failures")
            .register(registry);

        this.publishes = Counter.build()
            .name("relay_publish_total")
            .help("Events submitted through the publisher")
            .labelNames("status")
            .register(registry);
    }

    @Override
    public void recordConnectionOpened() {
        connectionsOpen.inc();
    }

    @Override
    public void recordConnectionClosed(String reason) {
        connectionsOpen.dec();
        connectionsClosed.labels(reason).inc();
    }

    @Override
    public void recordConnectionRejected(String reason) {
        connectionsRejected.labels(reason).inc();
    }

    @Override
    public void recordBroadcast(int recipients, int failures, Duration latency) {
        broadcasts.inc();
        broadcastRecipients.observe(recipients);
        broadcastLatency.observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordDeliveryFailure(String reason) {
        deliveryFailures.labels(reason).inc();
    }

    @Override
    public void recordChannelMessage(String outcome) {
        channelMessages.labels(outcome).inc();
    }

    @Override
    public void recordSubscriptionFailure() {
        subscriptionFailures.inc();
    }

    @Override
    public void recordPublish(boolean success) {
        publishes.labels(success ? "success" : "failure").inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
