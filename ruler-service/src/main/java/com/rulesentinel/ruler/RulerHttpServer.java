package com.rulesentinel.ruler;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rulesentinel.core.manager.StrategyRuleManager;
import com.rulesentinel.core.wire.RuleType;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP API of the ruler process.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /api/v1/rules[?type=alert|record]}: every rule group,
 * streamed group by group</li>
 * <li>{@code GET /api/v1/alerts}: every active alert</li>
 * <li>{@code POST /-/reload}: reload the rule files</li>
 * <li>{@code GET /health}, {@code GET /readiness}: {@code {"status":"UP"}}</li>
 * <li>{@code GET /metrics}: Prometheus exposition of the process meters</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class RulerHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(RulerHttpServer.class);

    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);
    private static final String JSON = "application/json";
    private static final String PROMETHEUS_TEXT = "text/plain; version=0.0.4; charset=utf-8";
    private static final int HANDLER_THREADS = 4;

    /**
     * Action run by {@code POST /-/reload}.
     */
    @FunctionalInterface
    public interface ReloadAction {
        /**
         * @throws IOException if the rule files cannot be discovered
         */
        void reload() throws IOException;
    }

    private final StrategyRuleManager manager;
    private final ObjectMapper mapper;
    private final PrometheusMeterRegistry registry;
    private final ReloadAction reloadAction;

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public RulerHttpServer(StrategyRuleManager manager, ObjectMapper mapper,
            PrometheusMeterRegistry registry, ReloadAction reloadAction) {
        this.manager = Objects.requireNonNull(manager, "StrategyRuleManager must not be null");
        this.mapper = Objects.requireNonNull(mapper, "ObjectMapper must not be null");
        this.registry = Objects.requireNonNull(registry, "PrometheusMeterRegistry must not be null");
        this.reloadAction = Objects.requireNonNull(reloadAction, "ReloadAction must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; 0 binds an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     * @throws IOException              if the port cannot be bound
     */
    public void start(int port) throws IOException {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException("HTTP port must be in range [0, 65535], got: " + port);
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/api/v1/rules", guarded(this::handleRules));
        server.createContext("/api/v1/alerts", guarded(this::handleAlerts));
        server.createContext("/-/reload", guarded(this::handleReload));
        server.createContext("/health", guarded(RulerHttpServer::handleHealthCheck));
        server.createContext("/readiness", guarded(RulerHttpServer::handleHealthCheck));
        server.createContext("/metrics", guarded(this::handleMetrics));

        AtomicInteger threadCount = new AtomicInteger();
        executor = Executors.newFixedThreadPool(HANDLER_THREADS, r -> {
            Thread t = new Thread(r, "ruler-http-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", getPort());
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdown();
            LOG.info("HTTP server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port
     * @throws IllegalStateException if the server was never started
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("HTTP server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleRules(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        RuleType type;
        try {
            type = RuleType.fromParameter(queryParams(exchange).get("type"));
        } catch (IllegalArgumentException e) {
            sendError(exchange, 400, "bad_data", e.getMessage());
            return;
        }

        exchange.getResponseHeaders().set("Content-Type", JSON);
        exchange.sendResponseHeaders(200, 0);
        try (OutputStream os = exchange.getResponseBody();
                JsonGenerator generator = mapper.getFactory().createGenerator(os)) {
            generator.writeStartObject();
            generator.writeStringField("status", "success");
            generator.writeObjectFieldStart("data");
            generator.writeArrayFieldStart("groups");
            JsonRuleGroupWriter writer = new JsonRuleGroupWriter(generator);
            manager.rules(type, writer);
            generator.writeEndArray();
            generator.writeEndObject();
            generator.writeEndObject();
            LOG.debug("Streamed {} rule group(s) of type {}", writer.getWritten(), type);
        }
    }

    private void handleAlerts(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("alerts", manager.activeAlerts());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        body.put("data", data);
        send(exchange, 200, JSON, mapper.writeValueAsBytes(body));
    }

    private void handleReload(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        try {
            reloadAction.reload();
        } catch (IOException | RuntimeException e) {
            LOG.error("Rule reload failed: {}", e.getMessage());
            sendError(exchange, 500, "reload", e.getMessage());
            return;
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "success");
        send(exchange, 200, JSON, mapper.writeValueAsBytes(body));
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        send(exchange, 200, PROMETHEUS_TEXT, registry.scrape().getBytes(StandardCharsets.UTF_8));
    }

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        send(exchange, 200, JSON, HEALTH_RESPONSE);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (IOException | RuntimeException e) {
                LOG.error("{} {} failed", exchange.getRequestMethod(), exchange.getRequestURI(), e);
                if (exchange.getResponseCode() == -1) {
                    sendError(exchange, 500, "internal", String.valueOf(e.getMessage()));
                }
            } finally {
                exchange.close();
            }
        };
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        sendError(exchange, 405, "method_not_allowed", exchange.getRequestMethod() + " not allowed");
        return false;
    }

    private void sendError(HttpExchange exchange, int status, String errorType, String error)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("errorType", errorType);
        body.put("error", error);
        send(exchange, status, JSON, mapper.writeValueAsBytes(body));
    }

    private static void send(HttpExchange exchange, int status, String contentType, byte[] body)
            throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new HashMap<>();
        String raw = exchange.getRequestURI().getRawQuery();
        if (raw == null || raw.isEmpty()) {
            return params;
        }
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }
}
