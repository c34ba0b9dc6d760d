package in.receipttrack.relay.channel;

import in.receipttrack.domain.event.ReceiptEvent;
import in.receipttrack.infrastructure.common.ReconnectionPolicy;
import in.receipttrack.infrastructure.metrics.RelayMetrics;
import in.receipttrack.relay.broadcast.BroadcastResult;
import in.receipttrack.relay.broadcast.Broadcaster;
import in.receipttrack.relay.codec.EventDecodingException;
import in.receipttrack.relay.codec.ReceiptEventCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background consumer that pulls receipt events from the channel and hands each one
 * to the {@link Broadcaster}.
 *
 * Per message:
 * - decodes the payload; malformed payloads are logged and acked (redelivery cannot fix them)
 * - broadcasts, then acks
 * - nacks if the broadcast itself blew up, so the channel redelivers
 *
 * No deduplication: a redelivered message is broadcast again.
 *
 * Subscribe and fetch failures close the subscription and re-create it after a
 * {@link ReconnectionPolicy} delay. The loop only ends on {@link #stop(Duration)}.
 */
public final class ChannelListener {
    private static final Logger log = LoggerFactory.getLogger(ChannelListener.class);

    public static final String OUTCOME_BROADCAST = "broadcast";
    public static final String OUTCOME_MALFORMED = "malformed";
    public static final String OUTCOME_NACKED = "nacked";

    private final EventChannel channel;
    private final ChannelAddress address;
    private final String subscriptionName;
    private final ReceiptEventCodec codec;
    private final Broadcaster broadcaster;
    private final RelayMetrics metrics;
    private final ReconnectionPolicy reconnectionPolicy;
    private final int batchSize;
    private final Duration fetchWait;

    private final Object sleepLock = new Object();
    private volatile boolean running = false;
    private volatile Thread worker;

    public ChannelListener(EventChannel channel,
                           ChannelAddress address,
                           String subscriptionName,
                           ReceiptEventCodec codec,
                           Broadcaster broadcaster,
                           RelayMetrics metrics,
                           ReconnectionPolicy reconnectionPolicy,
                           int batchSize,
                           Duration fetchWait) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.channel = channel;
        this.address = address;
        this.subscriptionName = subscriptionName;
        this.codec = codec;
        this.broadcaster = broadcaster;
        this.metrics = metrics;
        this.reconnectionPolicy = reconnectionPolicy;
        this.batchSize = batchSize;
        this.fetchWait = fetchWait;
    }

    /**
     * Start the consumer thread. Calling it again while running has no effect.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[LISTENER] Already running on {}", address);
            return;
        }
        running = true;
        Thread t = new Thread(this::runLoop, "channel-listener");
        t.setDaemon(true);
        worker = t;
        t.start();
        log.info("[LISTENER] Started: address={} subscription={} batch={}", address, subscriptionName, batchSize);
    }

    /**
     * Stop pulling new messages. The batch in hand finishes (acks included) unless
     * it takes longer than {@code timeout}.
     */
    public void stop(Duration timeout) {
        Thread t;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            t = worker;
        }
        synchronized (sleepLock) {
            sleepLock.notifyAll();
        }
        if (t == null) {
            return;
        }
        try {
            t.join(timeout.toMillis());
            if (t.isAlive()) {
                log.warn("[LISTENER] Did not stop within {}ms, interrupting", timeout.toMillis());
                t.interrupt();
                t.join(TimeUnit.SECONDS.toMillis(1));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("[LISTENER] Stopped");
    }

    public boolean isRunning() {
        return running;
    }

    private void runLoop() {
        while (running) {
            ChannelSubscription subscription;
            try {
                subscription = channel.subscribe(address, subscriptionName);
            } catch (ChannelException | RuntimeException e) {
                onSubscriptionFailure("subscribe", e);
                continue;
            }

            reconnectionPolicy.recordSuccess();
            log.info("[LISTENER] Subscribed to {} as '{}'", address, subscriptionName);

            try {
                consume(subscription);
            } catch (ChannelException | RuntimeException e) {
                onSubscriptionFailure("fetch", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                running = false;
            } finally {
                try {
                    subscription.close();
                } catch (RuntimeException e) {
                    log.debug("[LISTENER] Subscription close failed (ignored): {}", e.toString());
                }
            }
        }
    }

    private void consume(ChannelSubscription subscription) throws ChannelException, InterruptedException {
        while (running) {
            List<InboundMessage> batch = subscription.fetch(batchSize, fetchWait);
            for (InboundMessage message : batch) {
                // Messages already fetched are handled even if stop() was called meanwhile,
                // so their acks are not lost.
                handle(message);
            }
        }
    }

    /**
     * Process one inbound message. Never throws.
     */
    void handle(InboundMessage message) {
        ReceiptEvent event;
        try {
            event = codec.decode(message.data());
        } catch (EventDecodingException e) {
            log.warn("[LISTENER] Dropping malformed message id={} attempt={}: {}",
                message.messageId(), message.deliveryAttempt(), e.getMessage());
            metrics.recordChannelMessage(OUTCOME_MALFORMED);
            acknowledge(message);
            return;
        }

        BroadcastResult result;
        try {
            result = broadcaster.broadcast(event);
        } catch (RuntimeException e) {
            log.error("[LISTENER] Broadcast failed for message id={}, requesting redelivery",
                message.messageId(), e);
            metrics.recordChannelMessage(OUTCOME_NACKED);
            try {
                message.nak();
            } catch (ChannelException nakFailure) {
                log.warn("[LISTENER] Nak failed for message id={}: {}", message.messageId(), nakFailure.getMessage());
            }
            return;
        }

        metrics.recordChannelMessage(OUTCOME_BROADCAST);
        if (message.deliveryAttempt() > 1) {
            log.info("[LISTENER] Redelivered message id={} attempt={} broadcast again to {} client(s)",
                message.messageId(), message.deliveryAttempt(), result.delivered());
        }
        acknowledge(message);
    }

    private void acknowledge(InboundMessage message) {
        try {
            message.ack();
        } catch (ChannelException e) {
            // The channel will redeliver; clients may see this event twice.
            log.warn("[LISTENER] Ack failed for message id={}: {}", message.messageId(), e.getMessage());
        }
    }

    private void onSubscriptionFailure(String stage, Exception e) {
        metrics.recordSubscriptionFailure();
        Duration delay = reconnectionPolicy.getNextDelay();
        reconnectionPolicy.recordFailure();
        int attempts = reconnectionPolicy.getAttemptCount();

        if (reconnectionPolicy.shouldAlert()) {
            log.error("[LISTENER] Channel {} failed {} times in a row on {}: {}. Retrying in {}ms",
                stage, attempts, address, e.toString(), delay.toMillis());
        } else {
            log.warn("[LISTENER] Channel {} failed on {} (attempt {}): {}. Retrying in {}ms",
                stage, address, attempts, e.toString(), delay.toMillis());
        }
        pause(delay);
    }

    private void pause(Duration delay) {
        synchronized (sleepLock) {
            if (!running) {
                return;
            }
            try {
                sleepLock.wait(delay.toMillis());
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                running = false;
            }
        }
    }
}
