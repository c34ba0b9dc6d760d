package in.receipttrack.transport.ws;

import in.receipttrack.relay.registry.ClientConnection;
import in.receipttrack.relay.registry.ConnectionState;
import io.undertow.websockets.core.CloseMessage;
import io.undertow.websockets.core.WebSocketCallback;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * A registered WebSocket peer with a bounded outbound queue.
 *
 * Payloads are written one at a time with Undertow's async send; the next one goes
 * out from the completion callback. A payload stays in the queue until its write
 * completes, so the capacity bounds everything not yet on the wire.
 *
 * Closing always happens through the channel: {@link #requestClose} reports the
 * connection through {@code onClosing} as soon as it stops being open, sends a close
 * frame (hard close after a grace period), and the channel's close listener reports
 * back through {@code onClosed} exactly once.
 */
final class WsClientConnection implements ClientConnection {
    private static final Logger log = LoggerFactory.getLogger(WsClientConnection.class);

    static final long CLOSE_GRACE_MS = 5_000;

    private final WebSocketChannel channel;
    private final BlockingQueue<String> outbound;
    private final Consumer<WsClientConnection> onClosing;
    private final Consumer<WsClientConnection> onClosed;

    private final AtomicBoolean sending = new AtomicBoolean(false);
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.OPEN);
    private volatile long connectionId;
    private volatile String closeReason = "peer_closed";

    WsClientConnection(WebSocketChannel channel, int queueCapacity,
                       Consumer<WsClientConnection> onClosing, Consumer<WsClientConnection> onClosed) {
        this.channel = channel;
        this.outbound = new ArrayBlockingQueue<>(queueCapacity);
        this.onClosing = onClosing;
        this.onClosed = onClosed;
    }

    @Override
    public long connectionId() {
        return connectionId;
    }

    @Override
    public void onRegistered(long connectionId) {
        this.connectionId = connectionId;
    }

    @Override
    public ConnectionState state() {
        return state.get();
    }

    String closeReason() {
        return closeReason;
    }

    int queuedMessages() {
        return outbound.size();
    }

    @Override
    public boolean offer(String payload) {
        if (state.get() != ConnectionState.OPEN) {
            return false;
        }
        if (!outbound.offer(payload)) {
            return false;
        }
        drain();
        return true;
    }

    private void drain() {
        while (state.get() == ConnectionState.OPEN) {
            if (!sending.compareAndSet(false, true)) {
                return;
            }
            String next = outbound.peek();
            if (next != null) {
                send(next);
                return;
            }
            sending.set(false);
            if (outbound.isEmpty()) {
                return;
            }
            // An offer landed after peek and lost the race for the send flag.
        }
    }

    private void send(String payload) {
        WebSockets.sendText(payload, channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                outbound.poll();
                sending.set(false);
                drain();
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                sending.set(false);
                log.debug("[RELAY] Write to connection {} failed: {}", connectionId, throwable.toString());
                requestClose("write_failed");
            }
        });
    }

    @Override
    public void requestClose(String reason) {
        requestClose(CloseMessage.GOING_AWAY, reason);
    }

    void requestClose(int code, String reason) {
        if (!state.compareAndSet(ConnectionState.OPEN, ConnectionState.CLOSING)) {
            return;
        }
        closeReason = reason;
        outbound.clear();
        onClosing.accept(this);

        if (!channel.isOpen()) {
            onChannelClosed();
            return;
        }

        WebSockets.sendClose(new CloseMessage(code, truncate(reason)), channel, new WebSocketCallback<Void>() {
            @Override
            public void complete(WebSocketChannel ch, Void context) {
                closeQuietly();
            }

            @Override
            public void onError(WebSocketChannel ch, Void context, Throwable throwable) {
                closeQuietly();
            }
        });
        // A peer that stopped reading never lets the close frame out.
        channel.getIoThread().executeAfter(this::closeQuietly, CLOSE_GRACE_MS, TimeUnit.MILLISECONDS);
    }

    /**
     * Invoked from the channel's close listener, or directly if the channel was
     * already closed when a close was requested.
     */
    void onChannelClosed() {
        ConnectionState previous = state.getAndSet(ConnectionState.CLOSED);
        if (previous == ConnectionState.CLOSED) {
            return;
        }
        outbound.clear();
        onClosed.accept(this);
    }

    private void closeQuietly() {
        if (!channel.isOpen()) {
            return;
        }
        try {
            channel.close();
        } catch (IOException e) {
            log.debug("[RELAY] Close of connection {} failed: {}", connectionId, e.toString());
        }
    }

    private static String truncate(String reason) {
        // Close frame reasons are limited to 123 bytes; ours are short ASCII.
        return reason.length() > 120 ? reason.substring(0, 120) : reason;
    }
}
