package in.receipttrack.infrastructure.memory;

import in.receipttrack.relay.channel.ChannelAddress;
import in.receipttrack.relay.channel.ChannelException;
import in.receipttrack.relay.channel.ChannelSubscription;
import in.receipttrack.relay.channel.EventChannel;
import in.receipttrack.relay.channel.InboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process channel with at-least-once semantics, for local runs ({@code CHANNEL_MODE=memory})
 * and tests.
 *
 * - Each named subscription gets its own copy of every message published to its topic.
 * - Messages published before any subscription exists are kept and handed to the first one.
 * - A nacked message, or one still unacked when its subscription closes, is queued again
 *   with its delivery attempt incremented.
 */
public final class InMemoryEventChannel implements EventChannel {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventChannel.class);

    private final Map<ChannelAddress, Topic> topics = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public ChannelSubscription subscribe(ChannelAddress address, String subscriptionName) throws ChannelException {
        ensureOpen();
        Topic topic = topics.computeIfAbsent(address, a -> new Topic());
        BlockingQueue<Delivery> queue = topic.group(subscriptionName);
        log.debug("[MEMORY] Subscription '{}' opened on {}", subscriptionName, address);
        return new MemorySubscription(queue);
    }

    @Override
    public String publish(ChannelAddress address, byte[] payload) throws ChannelException {
        ensureOpen();
        String id = Long.toString(sequence.incrementAndGet());
        topics.computeIfAbsent(address, a -> new Topic()).publish(id, payload.clone());
        log.debug("[MEMORY] Published id={} to {} ({} bytes)", id, address, payload.length);
        return id;
    }

    /**
     * Messages waiting to be fetched by a subscription (excluding in-flight ones).
     */
    public int pending(ChannelAddress address, String subscriptionName) {
        Topic topic = topics.get(address);
        return topic == null ? 0 : topic.pending(subscriptionName);
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            topics.clear();
        }
    }

    private void ensureOpen() throws ChannelException {
        if (closed.get()) {
            throw new ChannelException("Channel closed");
        }
    }

    private record Delivery(String id, byte[] data, int attempt) {
    }

    private static final class Topic {
        private final Map<String, BlockingQueue<Delivery>> groups = new ConcurrentHashMap<>();
        private final List<Delivery> unclaimed = new ArrayList<>();

        synchronized BlockingQueue<Delivery> group(String name) {
            BlockingQueue<Delivery> queue = groups.get(name);
            if (queue == null) {
                queue = new LinkedBlockingQueue<>();
                if (groups.isEmpty()) {
                    queue.addAll(unclaimed);
                    unclaimed.clear();
                }
                groups.put(name, queue);
            }
            return queue;
        }

        synchronized int pending(String name) {
            BlockingQueue<Delivery> queue = groups.get(name);
            return queue == null ? 0 : queue.size();
        }

        synchronized void publish(String id, byte[] data) {
            Delivery delivery = new Delivery(id, data, 1);
            if (groups.isEmpty()) {
                unclaimed.add(delivery);
                return;
            }
            for (BlockingQueue<Delivery> queue : groups.values()) {
                queue.add(delivery);
            }
        }
    }

    private static final class MemorySubscription implements ChannelSubscription {
        private final BlockingQueue<Delivery> queue;
        private final Set<MemoryMessage> inFlight = ConcurrentHashMap.newKeySet();
        private final AtomicBoolean closed = new AtomicBoolean(false);

        MemorySubscription(BlockingQueue<Delivery> queue) {
            this.queue = queue;
        }

        @Override
        public List<InboundMessage> fetch(int maxMessages, Duration maxWait)
                throws ChannelException, InterruptedException {
            if (closed.get()) {
                throw new ChannelException("Subscription closed");
            }
            Delivery first = queue.poll(maxWait.toMillis(), TimeUnit.MILLISECONDS);
            if (first == null) {
                return List.of();
            }
            List<Delivery> drained = new ArrayList<>();
            drained.add(first);
            queue.drainTo(drained, maxMessages - 1);

            List<InboundMessage> out = new ArrayList<>(drained.size());
            for (Delivery d : drained) {
                MemoryMessage m = new MemoryMessage(d, this);
                inFlight.add(m);
                out.add(m);
            }
            return out;
        }

        void settle(MemoryMessage message, boolean redeliver) {
            if (inFlight.remove(message) && redeliver) {
                Delivery d = message.delivery;
                queue.add(new Delivery(d.id(), d.data(), d.attempt() + 1));
            }
        }

        @Override
        public void close() {
            if (!closed.compareAndSet(false, true)) {
                return;
            }
            for (MemoryMessage m : List.copyOf(inFlight)) {
                settle(m, true);
            }
        }
    }

    private static final class MemoryMessage implements InboundMessage {
        private final Delivery delivery;
        private final MemorySubscription owner;
        private final AtomicBoolean settled = new AtomicBoolean(false);

        MemoryMessage(Delivery delivery, MemorySubscription owner) {
            this.delivery = delivery;
            this.owner = owner;
        }

        @Override
        public String messageId() {
            return delivery.id();
        }

        @Override
        public int deliveryAttempt() {
            return delivery.attempt();
        }

        @Override
        public byte[] data() {
            return delivery.data().clone();
        }

        @Override
        public void ack() throws ChannelException {
            settle(false);
        }

        @Override
        public void nak() throws ChannelException {
            settle(true);
        }

        private void settle(boolean redeliver) throws ChannelException {
            if (!settled.compareAndSet(false, true)) {
                throw new ChannelException("Message " + delivery.id() + " already settled");
            }
            owner.settle(this, redeliver);
        }
    }
}
