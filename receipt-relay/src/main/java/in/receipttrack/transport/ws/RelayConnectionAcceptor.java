package in.receipttrack.transport.ws;

import in.receipttrack.infrastructure.common.HeartbeatManager;
import in.receipttrack.infrastructure.metrics.RelayMetrics;
import in.receipttrack.relay.registry.ConnectionRegistry;
import in.receipttrack.relay.registry.ConnectionState;
import in.receipttrack.relay.registry.RegistryExhaustedException;
import io.undertow.server.HttpHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import io.undertow.websockets.WebSocketConnectionCallback;
import io.undertow.websockets.WebSocketProtocolHandshakeHandler;
import io.undertow.websockets.core.AbstractReceiveListener;
import io.undertow.websockets.core.BufferedBinaryMessage;
import io.undertow.websockets.core.BufferedTextMessage;
import io.undertow.websockets.core.WebSocketChannel;
import io.undertow.websockets.core.WebSockets;
import io.undertow.websockets.spi.WebSocketHttpExchange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Accepts WebSocket connections from live clients and owns each connection's loop.
 *
 * For every successful upgrade:
 * - the peer is registered (or refused with close code 1013 when the registry is full)
 * - a heartbeat pings it and closes it when pongs stop
 * - inbound text/binary frames are discarded; the relay only pushes
 * - any close, error or keepalive expiry unregisters it and releases the channel
 *
 * Plain HTTP requests on the relay path get a 400 and never touch the registry.
 */
public final class RelayConnectionAcceptor {
    private static final Logger log = LoggerFactory.getLogger(RelayConnectionAcceptor.class);

    /**
     * "Try Again Later" close code (RFC 6455 registry).
     */
    static final int CLOSE_TRY_AGAIN_LATER = 1013;

    private static final ByteBuffer PING_PAYLOAD = ByteBuffer.wrap(new byte[] {'k', 'a'});

    private final ConnectionRegistry registry;
    private final RelayMetrics metrics;
    private final int outboundQueueCapacity;
    private final Duration pingInterval;
    private final Duration pingTimeout;

    private final Map<Long, HeartbeatManager> heartbeats = new ConcurrentHashMap<>();
    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "relay-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public RelayConnectionAcceptor(ConnectionRegistry registry,
                                   RelayMetrics metrics,
                                   int outboundQueueCapacity,
                                   Duration pingInterval,
                                   Duration pingTimeout) {
        if (outboundQueueCapacity <= 0) {
            throw new IllegalArgumentException("outboundQueueCapacity must be positive");
        }
        this.registry = registry;
        this.metrics = metrics;
        this.outboundQueueCapacity = outboundQueueCapacity;
        this.pingInterval = pingInterval;
        this.pingTimeout = pingTimeout;
    }

    /**
     * Handler performing the upgrade handshake on the relay path.
     */
    public HttpHandler websocketHandler() {
        HttpHandler notUpgrade = exchange -> {
            exchange.setStatusCode(StatusCodes.BAD_REQUEST);
            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
            exchange.getResponseSender().send("Expected a WebSocket upgrade request");
        };
        return new WebSocketProtocolHandshakeHandler(new WebSocketConnectionCallback() {
            @Override
            public void onConnect(WebSocketHttpExchange exchange, WebSocketChannel channel) {
                accept(channel);
            }
        }, notUpgrade);
    }

    private void accept(WebSocketChannel channel) {
        WsClientConnection connection = new WsClientConnection(channel, outboundQueueCapacity,
            this::onClosing, this::onClosed);
        channel.getCloseSetter().set(c -> connection.onChannelClosed());

        long id;
        try {
            id = registry.register(connection);
        } catch (RegistryExhaustedException e) {
            log.warn("[RELAY] Refusing {}: {}", channel.getSourceAddress(), e.getMessage());
            metrics.recordConnectionRejected("registry_full");
            connection.requestClose(CLOSE_TRY_AGAIN_LATER, "server full");
            return;
        } catch (IllegalStateException e) {
            log.debug("[RELAY] {} went away during handshake", channel.getSourceAddress());
            metrics.recordConnectionRejected("closed_early");
            return;
        }

        metrics.recordConnectionOpened();

        HeartbeatManager heartbeat = new HeartbeatManager(
            "conn-" + id,
            heartbeatScheduler,
            pingInterval,
            pingTimeout,
            () -> WebSockets.sendPing(PING_PAYLOAD.duplicate(), channel, null),
            () -> connection.requestClose("keepalive_timeout")
        );
        heartbeats.put(id, heartbeat);

        channel.getReceiveSetter().set(new AbstractReceiveListener() {
            @Override
            protected void onFullTextMessage(WebSocketChannel ch, BufferedTextMessage message) {
                log.debug("[RELAY] Ignoring {} chars from connection {}", message.getData().length(), id);
            }

            @Override
            protected void onFullPongMessage(WebSocketChannel ch, BufferedBinaryMessage message) throws IOException {
                heartbeat.recordPong();
                super.onFullPongMessage(ch, message);
            }

            @Override
            protected void onError(WebSocketChannel ch, Throwable error) {
                log.debug("[RELAY] Read error on connection {}: {}", id, error.toString());
                connection.requestClose("read_error");
                super.onError(ch, error);
            }
        });
        channel.resumeReceives();
        heartbeat.start();

        // The channel may have closed before the close listener could see a registered id.
        if (!channel.isOpen()) {
            connection.onChannelClosed();
        }
        // onClosed may have run before the heartbeat was tracked.
        if (connection.state() == ConnectionState.CLOSED) {
            heartbeats.remove(id, heartbeat);
            heartbeat.stop();
            return;
        }

        log.info("[RELAY] Client {} connected from {} (total: {})", id, channel.getSourceAddress(), registry.size());
    }

    private void onClosing(WsClientConnection connection) {
        long id = connection.connectionId();
        if (id != 0) {
            registry.unregister(id);
        }
    }

    private void onClosed(WsClientConnection connection) {
        long id = connection.connectionId();
        if (id == 0) {
            // Never registered (refused); nothing to release but the channel itself.
            return;
        }
        registry.unregister(id);
        HeartbeatManager heartbeat = heartbeats.remove(id);
        if (heartbeat != null) {
            heartbeat.stop();
        }
        metrics.recordConnectionClosed(connection.closeReason());
        log.info("[RELAY] Client {} disconnected: {} (total: {})", id, connection.closeReason(), registry.size());
    }

    /**
     * Close every connection and stop the heartbeat scheduler.
     */
    public void shutdown() {
        registry.closeAll("shutdown");
        heartbeats.values().forEach(HeartbeatManager::stop);
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    int activeHeartbeats() {
        return heartbeats.size();
    }
}
