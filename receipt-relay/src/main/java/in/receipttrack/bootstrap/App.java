package in.receipttrack.bootstrap;

import in.receipttrack.infrastructure.common.ReconnectionPolicy;
import in.receipttrack.infrastructure.memory.InMemoryEventChannel;
import in.receipttrack.infrastructure.metrics.PrometheusMetricsHandler;
import in.receipttrack.infrastructure.metrics.PrometheusRelayMetrics;
import in.receipttrack.infrastructure.nats.JetStreamEventChannel;
import in.receipttrack.infrastructure.nats.NatsConfig;
import in.receipttrack.relay.broadcast.Broadcaster;
import in.receipttrack.relay.channel.ChannelException;
import in.receipttrack.relay.channel.ChannelListener;
import in.receipttrack.relay.channel.EventChannel;
import in.receipttrack.relay.codec.ReceiptEventCodec;
import in.receipttrack.relay.registry.ConnectionRegistry;
import in.receipttrack.transport.http.HealthHandler;
import in.receipttrack.transport.ws.RelayConnectionAcceptor;
import in.receipttrack.transport.ws.RelayServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Receipt event relay entry point.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    private static final Duration LISTENER_STOP_TIMEOUT = Duration.ofSeconds(10);

    public static void main(String[] args) {
        // ═══════════════════════════════════════════════════════════════
        // Configuration (fatal when invalid)
        // ═══════════════════════════════════════════════════════════════
        RelayConfig config;
        try {
            config = RelayConfig.fromEnv();
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Metrics, codec, registry, broadcaster
        // ═══════════════════════════════════════════════════════════════
        PrometheusRelayMetrics metrics = new PrometheusRelayMetrics();
        ReceiptEventCodec codec = new ReceiptEventCodec();
        ConnectionRegistry registry = new ConnectionRegistry(config.maxConnections());
        Broadcaster broadcaster = new Broadcaster(registry, codec, metrics);

        // ═══════════════════════════════════════════════════════════════
        // Event channel
        // ═══════════════════════════════════════════════════════════════
        EventChannel channel;
        try {
            channel = openChannel(config);
        } catch (ChannelException e) {
            log.error("[NATS] Cannot open event channel: {}", e.getMessage(), e);
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // WebSocket listener + /metrics + /health
        // ═══════════════════════════════════════════════════════════════
        RelayConnectionAcceptor acceptor = new RelayConnectionAcceptor(
            registry, metrics, config.outboundQueueCapacity(), config.pingInterval(), config.pingTimeout());
        RelayServer server = new RelayServer(
            acceptor, new PrometheusMetricsHandler(metrics.getRegistry()), new HealthHandler(registry));
        try {
            server.start(config.host(), config.port(), config.wsPath());
        } catch (RuntimeException e) {
            log.error("[RELAY] Cannot listen on {}:{}: {}", config.host(), config.port(), e.getMessage(), e);
            acceptor.shutdown();
            channel.close();
            System.exit(1);
            return;
        }

        // ═══════════════════════════════════════════════════════════════
        // Channel listener
        // ═══════════════════════════════════════════════════════════════
        ChannelListener listener = new ChannelListener(
            channel,
            config.channelAddress(),
            config.subscriptionId(),
            codec,
            broadcaster,
            metrics,
            ReconnectionPolicy.forChannelSubscription(),
            config.listenerBatchSize(),
            config.listenerFetchWait()
        );
        listener.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down relay...");
            listener.stop(LISTENER_STOP_TIMEOUT);
            acceptor.shutdown();
            server.stop();
            channel.close();
            log.info("Relay stopped");
        }, "relay-shutdown"));

        log.info("Receipt relay started on port {} (channel={}, subscription={})",
            server.getPort(), config.channelMode(), config.subscriptionId());
    }

    private static EventChannel openChannel(RelayConfig config) throws ChannelException {
        switch (config.channelMode()) {
            case MEMORY:
                log.warn("[MEMORY] CHANNEL_MODE=memory: events only flow within this process");
                return new InMemoryEventChannel();
            case NATS:
            default:
                NatsConfig nats = NatsConfig.defaults(config.natsUrl());
                JetStreamEventChannel channel = JetStreamEventChannel.connect(new NatsConfig(
                    nats.url(), nats.connectionName(), nats.connectTimeout(), config.natsEnsureStream(),
                    nats.streamMaxAge(), nats.ackWait()));
                try {
                    channel.ensureStream(config.projectId());
                } catch (ChannelException e) {
                    channel.close();
                    throw e;
                }
                return channel;
        }
    }

    private App() {}
}
