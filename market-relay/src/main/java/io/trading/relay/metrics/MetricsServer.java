package io.trading.relay.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.relay.config.RelayConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;

/**
 * HTTP server for exposing Prometheus metrics and REST API.
 * Serves metrics, status, health, and config endpoints.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final RelayConfig config;
    private final Supplier<RelayStatus> statusSource;
    private final CollectorRegistry registry;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    /**
     * @param port         Port to listen on, 0 for an ephemeral port
     * @param metrics      Metrics to expose
     * @param config       Configuration shown by the config endpoint
     * @param statusSource Supplies the current relay status
     */
    public MetricsServer(int port, RelayMetrics metrics, RelayConfig config, Supplier<RelayStatus> statusSource) {
        this.port = port;
        this.config = config;
        this.statusSource = statusSource;
        this.registry = metrics.getRegistry();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        // Metrics endpoint (Prometheus)
        server.createContext("/metrics", handleMetrics());

        // Health endpoint (simple)
        server.createContext("/health", handleHealthSimple());

        // REST API endpoints
        server.createContext("/api/status", handleStatus());
        server.createContext("/api/health", handleHealth());
        server.createContext("/api/config", handleConfig());

        server.setExecutor(null);
        server.start();

        int boundPort = getPort();
        LOGGER.info("HTTP server started on port {}", boundPort);
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", boundPort);
        LOGGER.info("  API Status: http://localhost:{}/api/status", boundPort);
    }

    /**
     * Bound port, or -1 if not started.
     */
    public int getPort() {
        return server == null ? -1 : server.getAddress().getPort();
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
                exchange.close();
            }
        };
    }

    private HttpHandler handleHealthSimple() {
        return exchange -> send(exchange, 200, "text/plain", "OK");
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                StatusResponse response = new StatusResponse(
                    config.relayId(),
                    System.currentTimeMillis() - startTime,
                    statusSource.get()
                );
                sendJson(exchange, 200, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response));
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                RelayStatus status = statusSource.get();
                boolean healthy = !status.feedConfigured() || status.feedConnected();
                HealthResponse health = new HealthResponse(healthy,
                    healthy ? "All systems operational" : "Feed disconnected");
                sendJson(exchange, healthy ? 200 : 503,
                    objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(health));
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleConfig() {
        return exchange -> {
            try {
                ConfigInfo configInfo = new ConfigInfo(
                    config.relayId(),
                    config.feedUri() == null ? null : config.feedUri().toString(),
                    List.copyOf(config.instruments()),
                    config.listenHost(),
                    config.listenPort(),
                    config.writeTimeoutMs(),
                    config.reconnectMaxRetries(),
                    config.metricsPort(),
                    config.marketEndTime() == null ? null : config.marketEndTime().toString()
                );
                sendJson(exchange, 200, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configInfo));
            } catch (Exception e) {
                LOGGER.error("Error handling config request", e);
                sendJson(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private static void sendJson(HttpExchange exchange, int statusCode, String response) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        send(exchange, statusCode, "application/json", response);
    }

    private static void send(HttpExchange exchange, int statusCode, String contentType, String response)
        throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            server = null;
            LOGGER.info("HTTP server stopped");
        }
    }

    private record StatusResponse(String relayId, long uptimeMs, RelayStatus relay) {}
    private record HealthResponse(boolean healthy, String message) {}
    private record ConfigInfo(String relayId, String feedUri, List<String> instruments, String listenHost,
                              int listenPort, int writeTimeoutMs, int reconnectMaxRetries, int metricsPort,
                              String marketEndTime) {}
}
