package in.receipttrack.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.Methods;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * GET /metrics in Prometheus text format 0.0.4.
 *
 * Scrapers may restrict the output with repeated {@code name[]} parameters,
 * e.g. {@code /metrics?name[]=relay_connections_open}.
 *
 * Example output:
 * <pre>
 * # HELP relay_connections_open Currently open client connections
 * # TYPE relay_connections_open gauge
 * relay_connections_open 3.0
 * # HELP relay_channel_messages_total Inbound channel messages by outcome
 * # TYPE relay_channel_messages_total counter
 * relay_channel_messages_total{outcome="broadcast",} 118.0
 * relay_channel_messages_total{outcome="malformed",} 2.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        if (!Methods.GET.equals(exchange.getRequestMethod())) {
            exchange.setStatusCode(StatusCodes.METHOD_NOT_ALLOWED);
            exchange.getResponseHeaders().put(Headers.ALLOW, Methods.GET_STRING);
            exchange.endExchange();
            return;
        }

        StringWriter writer = new StringWriter();
        try {
            TextFormat.write004(writer, registry.filteredMetricFamilySamples(requestedNames(exchange)));
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(writer.toString());
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        return names == null ? Set.of() : new HashSet<>(names);
    }
}
