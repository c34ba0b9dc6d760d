package in.receipttrack.transport.ws;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import in.receipttrack.domain.event.EventKind;
import in.receipttrack.domain.event.EventStatus;
import in.receipttrack.domain.event.ReceiptEvent;
import in.receipttrack.infrastructure.metrics.PrometheusMetricsHandler;
import in.receipttrack.infrastructure.metrics.PrometheusRelayMetrics;
import in.receipttrack.relay.broadcast.BroadcastResult;
import in.receipttrack.relay.broadcast.Broadcaster;
import in.receipttrack.relay.codec.ReceiptEventCodec;
import in.receipttrack.relay.registry.ClientConnection;
import in.receipttrack.relay.registry.ConnectionRegistry;
import in.receipttrack.transport.http.HealthHandler;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Relay server tests over real sockets: Undertow on an ephemeral port, JDK WebSocket clients.
 *
 * Tests:
 * - Fan-out to every connected client, nothing retroactive for late joiners
 * - Non-upgrade requests rejected with 400
 * - Registry limit closes the extra peer with 1013
 * - Disconnects leave the registry
 * - Answered pings keep connections alive, unanswered pings drop the peer
 * - A peer that stops reading overflows its queue and leaves the next snapshot
 * - A close request takes the connection out of the registry at once
 * - Connections closed right after the handshake leave no heartbeat behind
 * - /health and /metrics on the same listener
 */
class RelayServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Instant T0 = Instant.parse("2024-05-01T10:15:30Z");

    private final ReceiptEventCodec codec = new ReceiptEventCodec();
    private final List<WsTestClient> clients = new ArrayList<>();
    private HttpClient http;
    private CollectorRegistry collectorRegistry;
    private ConnectionRegistry registry;
    private Broadcaster broadcaster;
    private RelayConnectionAcceptor acceptor;
    private RelayServer server;

    @BeforeEach
    void setUp() {
        http = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        clients.forEach(WsTestClient::abort);
        if (acceptor != null) {
            acceptor.shutdown();
        }
        if (server != null) {
            server.stop();
        }
    }

    @Test
    void testThreeClientsReceiveEventAndLateJoinerGetsNothing() throws Exception {
        start(100, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient c1 = connect();
        WsTestClient c2 = connect();
        WsTestClient c3 = connect();
        awaitTrue(() -> registry.size() == 3, "3 clients registered");

        BroadcastResult result = broadcaster.broadcast(
            new ReceiptEvent(EventKind.RECEIPT_UPLOAD, EventStatus.RECEIVED, "r1", "u1", T0));
        assertEquals(new BroadcastResult(3, 3, 0), result);

        for (WsTestClient c : List.of(c1, c2, c3)) {
            awaitTrue(() -> c.messages().size() == 1, "client received the event");
            JsonNode json = MAPPER.readTree(c.messages().get(0));
            assertEquals("receipt_upload", json.get("type").asText());
            assertEquals("received", json.get("status").asText());
            assertEquals("r1", json.get("receipt_id").asText());
            assertEquals("u1", json.get("user_uid").asText());
            assertEquals("2024-05-01T10:15:30Z", json.get("timestamp").asText());
        }

        WsTestClient late = connect();
        awaitTrue(() -> registry.size() == 4, "late client registered");
        Thread.sleep(200);
        assertTrue(late.messages().isEmpty(), "No replay for clients connecting afterwards");

        broadcaster.broadcast(new ReceiptEvent(EventKind.RECEIPT_UPDATE, EventStatus.PROCESSED, "r1", "u1", T0));
        awaitTrue(() -> late.messages().size() == 1, "late client receives subsequent events");
        awaitTrue(() -> c1.messages().size() == 2, "earlier clients receive it too");
    }

    @Test
    void testMessagesArriveInBroadcastOrderPerClient() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient client = connect();
        awaitTrue(() -> registry.size() == 1, "client registered");

        List<String> expected = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ReceiptEvent event = new ReceiptEvent(EventKind.RECEIPT_UPDATE, EventStatus.PROCESSING_STARTED,
                "r" + i, "u1", T0);
            expected.add(codec.encode(event));
            broadcaster.broadcast(event);
            // Stay under the outbound queue capacity
            awaitTrue(() -> client.messages().size() == expected.size(), "message delivered");
        }

        assertEquals(expected, client.messages());
    }

    @Test
    void testNonUpgradeRequestRejected() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));

        HttpResponse<String> response = http.send(
            HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + "/")).GET().build(),
            HttpResponse.BodyHandlers.ofString());

        assertEquals(400, response.statusCode());
        assertEquals(0, registry.size());
    }

    @Test
    void testRegistryFullClosesWithTryAgainLater() throws Exception {
        start(1, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient first = connect();
        awaitTrue(() -> registry.size() == 1, "first client registered");

        WsTestClient second = connect();

        assertEquals(RelayConnectionAcceptor.CLOSE_TRY_AGAIN_LATER, second.awaitCloseCode());
        assertEquals(1, registry.size(), "Existing connection unaffected");
        assertEquals(1.0, collectorRegistry.getSampleValue("relay_connections_rejected_total",
            new String[] {"reason"}, new String[] {"registry_full"}));

        broadcaster.broadcast(new ReceiptEvent(EventKind.RECEIPT_UPLOAD, EventStatus.RECEIVED, "r1", "u1", T0));
        awaitTrue(() -> first.messages().size() == 1, "first client still served");
    }

    @Test
    void testClientDisconnectUnregisters() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient a = connect();
        WsTestClient b = connect();
        awaitTrue(() -> registry.size() == 2, "both registered");

        a.close();

        awaitTrue(() -> registry.size() == 1, "closed client unregistered");
        awaitTrue(() -> acceptor.activeHeartbeats() == 1, "its heartbeat stopped");
        assertEquals(1.0, collectorRegistry.getSampleValue("relay_connections_open"));

        BroadcastResult result = broadcaster.broadcast(
            new ReceiptEvent(EventKind.RECEIPT_UPLOAD, EventStatus.RECEIVED, "r1", "u1", T0));
        assertEquals(1, result.attempted());
        awaitTrue(() -> b.messages().size() == 1, "remaining client served");
    }

    @Test
    void testInboundTextIgnored() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient client = connect();
        awaitTrue(() -> registry.size() == 1, "registered");

        client.sendText("{\"subscribe\":\"u1\"}");
        Thread.sleep(100);

        assertEquals(1, registry.size(), "Client messages do not affect the connection");
    }

    @Test
    void testAnsweredPingsKeepConnectionAlive() throws Exception {
        start(10, Duration.ofMillis(100), Duration.ofMillis(300));
        WsTestClient client = connect();
        awaitTrue(() -> registry.size() == 1, "registered");

        Thread.sleep(1_000);

        assertEquals(1, registry.size(), "JDK client pongs, so keepalive never expires");
        broadcaster.broadcast(new ReceiptEvent(EventKind.RECEIPT_UPLOAD, EventStatus.RECEIVED, "r1", "u1", T0));
        awaitTrue(() -> client.messages().size() == 1, "still receiving");
    }

    @Test
    void testUnansweredPingsDisconnectPeer() throws Exception {
        start(10, Duration.ofMillis(100), Duration.ofMillis(300));
        try (RawWsPeer silent = RawWsPeer.connect(server.getPort(), 64 * 1024)) {
            awaitTrue(() -> registry.size() == 1, "silent peer registered");
            awaitTrue(() -> acceptor.activeHeartbeats() == 1, "heartbeat started");

            awaitTrue(() -> registry.size() == 0, "peer unregistered after keepalive timeout", Duration.ofSeconds(10));
            awaitTrue(() -> acceptor.activeHeartbeats() == 0, "heartbeat released", Duration.ofSeconds(10));
            assertEquals(1.0, collectorRegistry.getSampleValue("relay_connections_closed_total",
                new String[] {"reason"}, new String[] {"keepalive_timeout"}));
        }
    }

    @Test
    void testStalledReaderOverflowsAndLeavesNextSnapshot() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient healthy = connect();
        try (RawWsPeer stalled = RawWsPeer.connect(server.getPort(), 4 * 1024)) {
            awaitTrue(() -> registry.size() == 2, "both registered");

            // Large payloads fill the socket buffers quickly, then the outbound queue.
            String bigId = "r".repeat(16 * 1024);
            BroadcastResult result = null;
            for (int i = 1; i <= 5_000; i++) {
                result = broadcaster.broadcast(
                    new ReceiptEvent(EventKind.RECEIPT_UPDATE, EventStatus.PROCESSING_STARTED, bigId, "u1", T0));
                if (result.failed() > 0) {
                    break;
                }
                // Keep the reading client drained so only the stalled peer can overflow
                int sent = i;
                awaitTrue(() -> healthy.messages().size() == sent, "healthy client keeps up");
            }
            assertNotNull(result);
            assertEquals(new BroadcastResult(2, 1, 1), result, "Stalled peer eventually overflows");

            assertEquals(1, registry.size(), "Stalled peer is out of the registry");
            BroadcastResult next = broadcaster.broadcast(
                new ReceiptEvent(EventKind.RECEIPT_UPDATE, EventStatus.PROCESSED, "r1", "u1", T0));
            assertEquals(new BroadcastResult(1, 1, 0), next);
            assertEquals(1.0, collectorRegistry.getSampleValue("relay_delivery_failures_total",
                new String[] {"reason"}, new String[] {"queue_full"}));
            awaitTrue(() -> acceptor.activeHeartbeats() == 1, "stalled peer heartbeat released",
                Duration.ofSeconds(10));
        }
    }

    @Test
    void testCloseRequestUnregistersImmediately() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient client = connect();
        awaitTrue(() -> registry.size() == 1, "registered");
        ClientConnection connection = registry.snapshot().get(0);

        connection.requestClose("test_close");

        assertEquals(0, registry.size(), "Closing connection is no longer listed");
        assertEquals(0, broadcaster.broadcast(
            new ReceiptEvent(EventKind.RECEIPT_UPLOAD, EventStatus.RECEIVED, "r1", "u1", T0)).attempted());
        assertEquals(1001, client.awaitCloseCode());
        awaitTrue(() -> acceptor.activeHeartbeats() == 0, "heartbeat released");
    }

    @Test
    void testImmediateDisconnectsLeaveNoHeartbeat() throws Exception {
        start(100, Duration.ofSeconds(30), Duration.ofSeconds(60));

        for (int i = 0; i < 50; i++) {
            RawWsPeer.connect(server.getPort(), 64 * 1024).close();
        }

        awaitTrue(() -> endedConnections() == 50, "every peer accounted for", Duration.ofSeconds(10));
        assertEquals(0, registry.size());
        assertEquals(0, acceptor.activeHeartbeats(), "No heartbeat left behind");
        assertEquals(0.0, collectorRegistry.getSampleValue("relay_connections_open"));
    }

    @Test
    void testShutdownClosesClients() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));
        WsTestClient client = connect();
        awaitTrue(() -> registry.size() == 1, "registered");

        registry.closeAll("shutdown");

        assertEquals(1001, client.awaitCloseCode(), "Going away");
        awaitTrue(() -> registry.size() == 0, "unregistered after close");
    }

    @Test
    void testHealthAndMetricsEndpoints() throws Exception {
        start(10, Duration.ofSeconds(30), Duration.ofSeconds(60));
        connect();
        awaitTrue(() -> registry.size() == 1, "registered");

        HttpResponse<String> health = http.send(
            HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + "/health")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(200, health.statusCode());
        JsonNode json = MAPPER.readTree(health.body());
        assertEquals("UP", json.get("status").asText());
        assertEquals(1, json.get("connections").asInt());

        HttpResponse<String> metrics = http.send(
            HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + "/metrics")).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        assertEquals(200, metrics.statusCode());
        assertTrue(metrics.body().contains("relay_connections_open 1.0"), metrics.body());
    }

    private void start(int maxConnections, Duration pingInterval, Duration pingTimeout) {
        collectorRegistry = new CollectorRegistry();
        PrometheusRelayMetrics metrics = new PrometheusRelayMetrics(collectorRegistry);
        registry = new ConnectionRegistry(maxConnections);
        broadcaster = new Broadcaster(registry, codec, metrics);
        acceptor = new RelayConnectionAcceptor(registry, metrics, 16, pingInterval, pingTimeout);
        server = new RelayServer(acceptor, new PrometheusMetricsHandler(collectorRegistry), new HealthHandler(registry));
        server.start("127.0.0.1", 0, "/");
    }

    private double endedConnections() {
        return sample("relay_connections_closed_total", "peer_closed")
            + sample("relay_connections_closed_total", "read_error")
            + sample("relay_connections_rejected_total", "closed_early");
    }

    private double sample(String name, String reason) {
        Double value = collectorRegistry.getSampleValue(name, new String[] {"reason"}, new String[] {reason});
        return value == null ? 0.0 : value;
    }

    private WsTestClient connect() throws Exception {
        WsTestClient client = WsTestClient.connect(http, server.getPort());
        clients.add(client);
        return client;
    }

    static void awaitTrue(BooleanSupplier condition, String what) throws InterruptedException {
        awaitTrue(condition, what, Duration.ofSeconds(5));
    }

    static void awaitTrue(BooleanSupplier condition, String what, Duration timeout) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeout.toMillis();
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(10);
        }
        fail("Timed out waiting for: " + what);
    }
}
