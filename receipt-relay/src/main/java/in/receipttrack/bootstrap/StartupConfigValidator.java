package in.receipttrack.bootstrap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Startup configuration validator.
 *
 * Runs before any listener, socket or channel is opened. Collects every problem and
 * throws one IllegalStateException listing them, so a bad deployment fails once with
 * the full picture.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    // Identifiers double as NATS stream, subject and consumer names.
    private static final Pattern CHANNEL_NAME = Pattern.compile("[A-Za-z0-9_-]+");

    /**
     * @throws IllegalStateException if the configuration is invalid
     */
    public static void validate(RelayConfig config) {
        log.info("Running startup config validation...");
        List<String> problems = new ArrayList<>();

        if (config.host() == null || config.host().isBlank()) {
            problems.add("RELAY_HOST must not be blank");
        }
        if (config.port() < 0 || config.port() > 65535) {
            problems.add("RELAY_PORT must be between 0 and 65535, got " + config.port());
        }
        if (config.wsPath() == null || !config.wsPath().startsWith("/")) {
            problems.add("RELAY_WS_PATH must start with '/', got '" + config.wsPath() + "'");
        }
        requirePositive(problems, "RELAY_MAX_CONNECTIONS", config.maxConnections());
        requirePositive(problems, "RELAY_OUTBOUND_QUEUE_CAPACITY", config.outboundQueueCapacity());
        requirePositive(problems, "RELAY_PING_INTERVAL_MS", config.pingInterval());
        requirePositive(problems, "RELAY_PING_TIMEOUT_MS", config.pingTimeout());
        if (config.pingTimeout().compareTo(config.pingInterval()) < 0) {
            problems.add("RELAY_PING_TIMEOUT_MS must not be shorter than RELAY_PING_INTERVAL_MS");
        }

        requireChannelName(problems, "PUBSUB_PROJECT_ID", config.projectId());
        requireChannelName(problems, "PUBSUB_TOPIC_ID", config.topicId());
        requireChannelName(problems, "PUBSUB_SUBSCRIPTION_ID", config.subscriptionId());
        if (config.channelMode() == RelayConfig.ChannelMode.NATS
                && (config.natsUrl() == null || config.natsUrl().isBlank())) {
            problems.add("NATS_URL is required when CHANNEL_MODE=nats");
        }
        requirePositive(problems, "LISTENER_BATCH_SIZE", config.listenerBatchSize());
        requirePositive(problems, "LISTENER_FETCH_WAIT_MS", config.listenerFetchWait());

        if (!problems.isEmpty()) {
            throw new IllegalStateException("INVALID CONFIG, relay refuses to start:\n  - "
                + String.join("\n  - ", problems));
        }

        log.info("Startup config validation passed (channel={}, address={}/{}, subscription={})",
            config.channelMode(), config.projectId(), config.topicId(), config.subscriptionId());
    }

    private static void requirePositive(List<String> problems, String name, int value) {
        if (value <= 0) {
            problems.add(name + " must be positive, got " + value);
        }
    }

    private static void requirePositive(List<String> problems, String name, Duration value) {
        if (value.isZero() || value.isNegative()) {
            problems.add(name + " must be positive, got " + value.toMillis());
        }
    }

    private static void requireChannelName(List<String> problems, String name, String value) {
        if (value == null || !CHANNEL_NAME.matcher(value).matches()) {
            problems.add(name + " must match [A-Za-z0-9_-]+, got '" + value + "'");
        }
    }

    private StartupConfigValidator() {}
}
