package in.receipttrack.infrastructure.nats;

import in.receipttrack.relay.channel.ChannelAddress;
import in.receipttrack.relay.channel.ChannelException;
import in.receipttrack.relay.channel.ChannelSubscription;
import in.receipttrack.relay.channel.EventChannel;
import in.receipttrack.relay.channel.InboundMessage;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.Nats;
import io.nats.client.Options;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
import io.nats.client.api.PublishAck;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * {@link EventChannel} backed by NATS JetStream.
 *
 * Mapping:
 * - project id  → stream name (subjects {@code <project>.>})
 * - topic id    → subject {@code <project>.<topic>}
 * - subscription name → durable pull consumer with explicit ack
 * - message id  → stream sequence
 * - delivery attempt → JetStream delivered count
 *
 * One NATS connection is shared by publishing and subscribing. The client library
 * reconnects on its own; a subscription that breaks surfaces as a {@link ChannelException}
 * from {@code fetch} and is re-created by the caller.
 */
public final class JetStreamEventChannel implements EventChannel {
    private static final Logger log = LoggerFactory.getLogger(JetStreamEventChannel.class);

    /**
     * JetStream API error code for "stream not found".
     */
    private static final int JS_STREAM_NOT_FOUND_ERR = 10059;

    private static final Pattern TOKEN = Pattern.compile("[A-Za-z0-9_-]+");

    private final Connection connection;
    private final JetStream js;
    private final JetStreamManagement jsm;
    private final NatsConfig config;
    private final Set<String> verifiedStreams = ConcurrentHashMap.newKeySet();

    JetStreamEventChannel(Connection connection, NatsConfig config) throws IOException {
        this.connection = connection;
        this.js = connection.jetStream();
        this.jsm = connection.jetStreamManagement();
        this.config = config;
    }

    /**
     * Connect to the NATS server. Failure here is a startup failure.
     */
    public static JetStreamEventChannel connect(NatsConfig config) throws ChannelException {
        Options options = new Options.Builder()
            .server(config.url())
            .connectionName(config.connectionName())
            .connectionTimeout(config.connectTimeout())
            .maxReconnects(-1)
            .build();
        try {
            Connection nc = Nats.connect(options);
            log.info("[NATS] Connected to {} as '{}'", config.url(), config.connectionName());
            return new JetStreamEventChannel(nc, config);
        } catch (IOException e) {
            throw new ChannelException("Cannot connect to NATS at " + config.url() + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ChannelException("Interrupted while connecting to NATS at " + config.url(), e);
        }
    }

    /**
     * Make sure the stream for a project exists, creating it if allowed.
     */
    public void ensureStream(String projectId) throws ChannelException {
        String stream = streamName(projectId);
        if (verifiedStreams.contains(stream)) {
            return;
        }
        try {
            jsm.getStreamInfo(stream);
            verifiedStreams.add(stream);
            return;
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != JS_STREAM_NOT_FOUND_ERR) {
                throw new ChannelException("Stream lookup failed for " + stream + ": " + e.getMessage(), e);
            }
        } catch (IOException e) {
            throw new ChannelException("Stream lookup failed for " + stream + ": " + e.getMessage(), e);
        }

        if (!config.ensureStream()) {
            throw new ChannelException("Stream " + stream + " does not exist and NATS_ENSURE_STREAM is off");
        }

        StreamConfiguration desired = StreamConfiguration.builder()
            .name(stream)
            .subjects(stream + ".>")
            .retentionPolicy(RetentionPolicy.Limits)
            .storageType(StorageType.File)
            .maxAge(config.streamMaxAge())
            .build();
        try {
            jsm.addStream(desired);
            verifiedStreams.add(stream);
            log.info("[NATS] Created stream {} (subjects={}, maxAge={})",
                stream, desired.getSubjects(), desired.getMaxAge());
        } catch (IOException | JetStreamApiException e) {
            throw new ChannelException("Cannot create stream " + stream + ": " + e.getMessage(), e);
        }
    }

    @Override
    public ChannelSubscription subscribe(ChannelAddress address, String subscriptionName) throws ChannelException {
        requireToken(subscriptionName, "subscription name");
        ensureStream(address.projectId());

        String subject = subject(address);
        ConsumerConfiguration consumerConfig = ConsumerConfiguration.builder()
            .durable(subscriptionName)
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(config.ackWait())
            .deliverPolicy(DeliverPolicy.New)
            .filterSubject(subject)
            .build();

        PullSubscribeOptions pso = PullSubscribeOptions.builder()
            .stream(streamName(address.projectId()))
            .configuration(consumerConfig)
            .build();

        try {
            JetStreamSubscription sub = js.subscribe(subject, pso);
            log.info("[NATS] Pull subscription on {} durable={}", subject, subscriptionName);
            return new JetStreamPullSubscription(sub, subject);
        } catch (IOException | JetStreamApiException e) {
            throw new ChannelException("Subscribe failed on " + subject + ": " + e.getMessage(), e);
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new ChannelException("Subscribe rejected on " + subject + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String publish(ChannelAddress address, byte[] payload) throws ChannelException {
        ensureStream(address.projectId());
        String subject = subject(address);
        try {
            PublishAck ack = js.publish(subject, payload);
            log.debug("[NATS] Published to {} stream={} seq={}", subject, ack.getStream(), ack.getSeqno());
            return Long.toString(ack.getSeqno());
        } catch (IOException | JetStreamApiException e) {
            throw new ChannelException("Publish failed on " + subject + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            log.info("[NATS] Connection closed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[NATS] Interrupted while closing connection");
        }
    }

    static String streamName(String projectId) {
        requireToken(projectId, "project id");
        return projectId;
    }

    static String subject(ChannelAddress address) {
        requireToken(address.topicId(), "topic id");
        return streamName(address.projectId()) + "." + address.topicId();
    }

    private static void requireToken(String value, String what) {
        if (value == null || !TOKEN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid " + what + " for NATS: '" + value + "'");
        }
    }

    private static final class JetStreamPullSubscription implements ChannelSubscription {
        private final JetStreamSubscription sub;
        private final String subject;

        JetStreamPullSubscription(JetStreamSubscription sub, String subject) {
            this.sub = sub;
            this.subject = subject;
        }

        @Override
        public List<InboundMessage> fetch(int maxMessages, Duration maxWait) throws ChannelException {
            List<Message> messages;
            try {
                messages = sub.fetch(maxMessages, maxWait);
            } catch (RuntimeException e) {
                throw new ChannelException("Fetch failed on " + subject + ": " + e.getMessage(), e);
            }
            List<InboundMessage> out = new ArrayList<>(messages.size());
            for (Message m : messages) {
                if (m.isJetStream()) {
                    out.add(new JetStreamInboundMessage(m));
                }
            }
            return out;
        }

        @Override
        public void close() {
            try {
                sub.unsubscribe();
            } catch (RuntimeException e) {
                log.debug("[NATS] Unsubscribe failed (ignored): {}", e.toString());
            }
        }
    }

    private static final class JetStreamInboundMessage implements InboundMessage {
        private final Message message;

        JetStreamInboundMessage(Message message) {
            this.message = message;
        }

        @Override
        public String messageId() {
            return Long.toString(message.metaData().streamSequence());
        }

        @Override
        public int deliveryAttempt() {
            return (int) Math.min(Integer.MAX_VALUE, message.metaData().deliveredCount());
        }

        @Override
        public byte[] data() {
            byte[] data = message.getData();
            return data == null ? new byte[0] : data;
        }

        @Override
        public void ack() throws ChannelException {
            try {
                message.ack();
            } catch (RuntimeException e) {
                throw new ChannelException("Ack failed: " + e.getMessage(), e);
            }
        }

        @Override
        public void nak() throws ChannelException {
            try {
                message.nak();
            } catch (RuntimeException e) {
                throw new ChannelException("Nak failed: " + e.getMessage(), e);
            }
        }
    }
}
