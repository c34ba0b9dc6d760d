package in.receipttrack.infrastructure.nats;

import java.time.Duration;
import java.util.Objects;

/**
 * NATS connection and JetStream settings.
 *
 * @param url            server URL, e.g. {@code nats://localhost:4222}
 * @param connectionName name shown in server monitoring
 * @param connectTimeout initial connect timeout; failing it is fatal at startup
 * @param ensureStream   create the project's stream when it does not exist
 * @param streamMaxAge   retention for a stream this process creates
 * @param ackWait        how long the server waits for an ack before redelivering
 */
public record NatsConfig(
    String url,
    String connectionName,
    Duration connectTimeout,
    boolean ensureStream,
    Duration streamMaxAge,
    Duration ackWait
) {
    public NatsConfig {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(connectionName, "connectionName");
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(streamMaxAge, "streamMaxAge");
        Objects.requireNonNull(ackWait, "ackWait");
    }

    public static NatsConfig defaults(String url) {
        return new NatsConfig(url, "receipt-relay", Duration.ofSeconds(5), true,
            Duration.ofDays(1), Duration.ofSeconds(30));
    }
}
