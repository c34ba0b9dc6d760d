package in.receipttrack.transport.ws;

import io.undertow.Undertow;
import io.undertow.server.HttpHandler;
import io.undertow.server.handlers.PathHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;

/**
 * Undertow listener serving the relay WebSocket path plus the /metrics and /health
 * endpoints.
 */
public final class RelayServer {
    private static final Logger log = LoggerFactory.getLogger(RelayServer.class);

    private final RelayConnectionAcceptor acceptor;
    private final HttpHandler metricsHandler;
    private final HttpHandler healthHandler;
    private Undertow server;
    private int port;

    public RelayServer(RelayConnectionAcceptor acceptor, HttpHandler metricsHandler, HttpHandler healthHandler) {
        this.acceptor = acceptor;
        this.metricsHandler = metricsHandler;
        this.healthHandler = healthHandler;
    }

    /**
     * Bind and start serving. Port 0 binds an ephemeral port; see {@link #getPort()}.
     *
     * @throws IllegalStateException if already started
     * @throws RuntimeException if the listener cannot bind
     */
    public synchronized void start(String host, int port, String wsPath) {
        if (server != null) {
            throw new IllegalStateException("Relay server already started");
        }

        PathHandler paths = new PathHandler()
            .addExactPath("/metrics", metricsHandler)
            .addExactPath("/health", healthHandler)
            .addPrefixPath(wsPath, acceptor.websocketHandler());

        Undertow undertow = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(paths)
            .build();
        undertow.start();

        this.server = undertow;
        this.port = ((InetSocketAddress) undertow.getListenerInfo().get(0).getAddress()).getPort();
        log.info("[RELAY] Listening on ws://{}:{}{}", host, this.port, wsPath);
    }

    /**
     * The bound port, valid after {@link #start}.
     */
    public synchronized int getPort() {
        if (server == null) {
            throw new IllegalStateException("Relay server not started");
        }
        return port;
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop();
            server = null;
            log.info("[RELAY] Stopped");
        }
    }
}
