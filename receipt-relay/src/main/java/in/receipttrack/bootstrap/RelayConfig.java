package in.receipttrack.bootstrap;

import in.receipttrack.relay.channel.ChannelAddress;
import in.receipttrack.util.Env;

import java.time.Duration;
import java.util.Locale;

/**
 * Process configuration, read once at startup.
 *
 * Every field maps to one environment variable (system property fallback, see {@link Env}).
 * Values are not validated here; {@link StartupConfigValidator} does that before anything starts.
 */
public record RelayConfig(
    String host,
    int port,
    String wsPath,
    int maxConnections,
    int outboundQueueCapacity,
    Duration pingInterval,
    Duration pingTimeout,
    ChannelMode channelMode,
    String projectId,
    String topicId,
    String subscriptionId,
    String natsUrl,
    boolean natsEnsureStream,
    int listenerBatchSize,
    Duration listenerFetchWait
) {

    public enum ChannelMode {
        NATS,
        MEMORY;

        static ChannelMode parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid CHANNEL_MODE: '" + value + "' (expected nats or memory)", e);
            }
        }
    }

    public static RelayConfig fromEnv() {
        return new RelayConfig(
            Env.get("RELAY_HOST", "0.0.0.0"),
            Env.getInt("RELAY_PORT", 8765),
            Env.get("RELAY_WS_PATH", "/"),
            Env.getInt("RELAY_MAX_CONNECTIONS", 10_000),
            Env.getInt("RELAY_OUTBOUND_QUEUE_CAPACITY", 64),
            Duration.ofMillis(Env.getLong("RELAY_PING_INTERVAL_MS", 30_000)),
            Duration.ofMillis(Env.getLong("RELAY_PING_TIMEOUT_MS", 60_000)),
            ChannelMode.parse(Env.get("CHANNEL_MODE", "nats")),
            Env.get("PUBSUB_PROJECT_ID", "receipt-tracking-application"),
            Env.get("PUBSUB_TOPIC_ID", "receipt-updates"),
            Env.get("PUBSUB_SUBSCRIPTION_ID", "webapp-sub"),
            Env.get("NATS_URL", "nats://localhost:4222"),
            Env.getBool("NATS_ENSURE_STREAM", true),
            Env.getInt("LISTENER_BATCH_SIZE", 32),
            Duration.ofMillis(Env.getLong("LISTENER_FETCH_WAIT_MS", 500))
        );
    }

    public ChannelAddress channelAddress() {
        return new ChannelAddress(projectId, topicId);
    }
}
