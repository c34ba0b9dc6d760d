package in.receipttrack.transport.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.receipttrack.relay.registry.ConnectionRegistry;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

/**
 * GET /health: {@code {"status":"UP","connections":N}}.
 */
public final class HealthHandler implements HttpHandler {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ConnectionRegistry registry;

    public HealthHandler(ConnectionRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        ObjectNode health = MAPPER.createObjectNode();
        health.put("status", "UP");
        health.put("connections", registry.size());

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json; charset=utf-8");
        exchange.getResponseSender().send(MAPPER.writeValueAsString(health));
    }
}
