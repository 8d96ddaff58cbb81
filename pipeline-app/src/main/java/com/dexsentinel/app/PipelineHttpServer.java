package com.dexsentinel.app;

import com.dexsentinel.core.alert.AlertSystem;
import com.dexsentinel.core.dashboard.DashboardAggregator;
import com.dexsentinel.core.model.AlertLevel;
import com.dexsentinel.core.model.OperationResult;
import com.dexsentinel.core.model.Reason;
import com.dexsentinel.core.store.StoreUnavailableException;
import com.dexsentinel.core.stream.StreamProcessor;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * HTTP surface of the pipeline: exposes the stream processor, the alert
 * system and the dashboard as JSON endpoints.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health}: {@code {"status":"UP"}}</li>
 * <li>{@code POST /stream/start}, {@code POST /stream/stop}</li>
 * <li>{@code GET /stream/status}, {@code GET /stream/events?limit=}</li>
 * <li>{@code POST /stream/simulate?name=&rule=}</li>
 * <li>{@code POST /stream/rules?rule=&enabled=}</li>
 * <li>{@code GET /alerts/history?limit=&level=}, {@code GET /alerts/metrics}</li>
 * <li>{@code POST /alerts/test?level=},
 * {@code POST /alerts/send?level=&title=&message=}</li>
 * <li>{@code POST /alerts/clear}, {@code POST /alerts/export}</li>
 * <li>{@code POST /alerts/channels?channel=&enabled=}</li>
 * <li>{@code GET /dashboard/summary}</li>
 * </ul>
 *
 * <p>
 * Operations answer with {@code {"success", "reason", "message", "data"}}.
 * Failures map to 409 (lifecycle conflict), 404 (unknown rule or channel),
 * 400 (invalid input), 429 (suppressed or rate limited) and 503 (record store
 * unavailable).
 * </p>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer} so no external dependencies
 * (Jetty, Netty, etc.) are required.
 * </p>
 *
 * @since 1.0.0
 */
public class PipelineHttpServer {

    private static final Logger LOG = LoggerFactory.getLogger(PipelineHttpServer.class);

    private static final int DEFAULT_EVENT_LIMIT = 50;
    private static final int DEFAULT_ALERT_LIMIT = 100;
    private static final int WORKER_THREADS = 4;

    @FunctionalInterface
    private interface Handler {
        Response handle(Map<String, String> query) throws IOException;
    }

    private static final class Response {
        private final int status;
        private final Object body;

        private Response(int status, Object body) {
            this.status = status;
            this.body = body;
        }
    }

    private final StreamProcessor processor;
    private final AlertSystem alertSystem;
    private final DashboardAggregator dashboard;
    private final AlertExporter exporter;
    private final ObjectMapper mapper = JsonSupport.newObjectMapper();

    /** "METHOD path" to handler. */
    private final Map<String, Handler> routes = new HashMap<>();

    private HttpServer server;
    private ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public PipelineHttpServer(StreamProcessor processor, AlertSystem alertSystem,
            DashboardAggregator dashboard, AlertExporter exporter) {
        this.processor = Objects.requireNonNull(processor, "processor must not be null");
        this.alertSystem = Objects.requireNonNull(alertSystem, "alertSystem must not be null");
        this.dashboard = Objects.requireNonNull(dashboard, "dashboard must not be null");
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        registerRoutes();
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Start the server on the given port.
     *
     * @param port TCP port to bind to; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     * @throws IOException              if the port cannot be bound
     */
    public void start(int port) throws IOException {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "HTTP port must be in range [0, 65535], got: " + port);
        }
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/", this::dispatch);

        AtomicInteger threadIds = new AtomicInteger();
        executor = Executors.newFixedThreadPool(WORKER_THREADS, r -> {
            Thread t = new Thread(r, "http-worker-" + threadIds.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.start();
        running.set(true);
        LOG.info("HTTP server started on port {}", port());
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
    public int port() {
        if (server == null) {
            throw new IllegalStateException("HTTP server not started");
        }
        return server.getAddress().getPort();
    }

    // ---------------------------------------------------------------
    // Routes
    // ---------------------------------------------------------------

    private void registerRoutes() {
        route("GET", "/health", q -> new Response(200, Map.of("status", "UP")));

        route("POST", "/stream/start", q -> result(processor.start()));
        route("POST", "/stream/stop", q -> result(processor.stop()));
        route("GET", "/stream/status", q -> new Response(200, processor.status()));
        route("GET", "/stream/events", q -> new Response(200,
                processor.events(intParam(q, "limit", DEFAULT_EVENT_LIMIT))));
        route("POST", "/stream/simulate", q -> result(
                processor.simulate(required(q, "name"), required(q, "rule"))));
        route("POST", "/stream/rules", q -> result(
                processor.updateRule(required(q, "rule"), boolParam(q, "enabled"))));

        route("GET", "/alerts/history", q -> {
            int limit = intParam(q, "limit", DEFAULT_ALERT_LIMIT);
            String level = q.get("level");
            if (level == null || level.isBlank()) {
                return new Response(200, alertSystem.history(limit));
            }
            return AlertLevel.find(level)
                    .map(parsed -> new Response(200, alertSystem.history(limit, parsed)))
                    .orElseGet(() -> invalidLevel(level));
        });
        route("GET", "/alerts/metrics", q -> new Response(200, alertSystem.metrics()));
        route("POST", "/alerts/test", q -> result(alertSystem.test(q.getOrDefault("level", "info"))));
        route("POST", "/alerts/send", q -> {
            String level = q.getOrDefault("level", "info");
            return AlertLevel.find(level)
                    .map(parsed -> result(alertSystem.send(parsed, required(q, "title"),
                            q.get("message"), Map.of("source", "manual"))))
                    .orElseGet(() -> invalidLevel(level));
        });
        route("POST", "/alerts/clear", q -> {
            int removed = alertSystem.clear();
            return result(OperationResult.ok(Map.of("cleared_count", removed),
                    removed + " alert(s) removed"));
        });
        route("POST", "/alerts/export", q -> {
            Path file = exporter.export();
            return result(OperationResult.ok(Map.of("file", file.toString()), "Alerts exported"));
        });
        route("POST", "/alerts/channels", q -> result(
                alertSystem.setChannelEnabled(required(q, "channel"), boolParam(q, "enabled"))));

        route("GET", "/dashboard/summary", q -> new Response(200, dashboard.summarize()));
    }

    private void route(String method, String path, Handler handler) {
        routes.put(method + " " + path, handler);
    }

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------

    private void dispatch(HttpExchange exchange) throws IOException {
        String method = exchange.getRequestMethod();
        String path = exchange.getRequestURI().getPath();
        Handler handler = routes.get(method + " " + path);

        Response response;
        if (handler == null) {
            response = isKnownPath(path)
                    ? error(405, "Method " + method + " not allowed on " + path)
                    : error(404, "Not found: " + path);
        } else {
            try {
                response = handler.handle(parseQuery(exchange.getRequestURI().getRawQuery()));
            } catch (StoreUnavailableException e) {
                LOG.error("Record store unavailable while handling {} {}", method, path, e);
                response = error(503, "Record store unavailable: " + e.getMessage());
            } catch (IllegalArgumentException e) {
                response = error(400, e.getMessage());
            } catch (IOException | RuntimeException e) {
                LOG.error("Request {} {} failed", method, path, e);
                response = error(500, "Internal error: " + e.getMessage());
            }
        }
        write(exchange, response);
    }

    private boolean isKnownPath(String path) {
        return routes.keySet().stream().anyMatch(key -> key.endsWith(" " + path));
    }

    private void write(HttpExchange exchange, Response response) throws IOException {
        byte[] body = mapper.writeValueAsBytes(response.body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    // ---------------------------------------------------------------
    // Responses
    // ---------------------------------------------------------------

    private static Response result(OperationResult<?> result) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", result.isSuccess());
        body.put("reason", result.getReason());
        body.put("message", result.getMessage());
        body.put("data", result.getValue().orElse(null));
        return new Response(result.isSuccess() ? 200 : statusFor(result.getReason()), body);
    }

    private static Response error(int status, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("error", message);
        return new Response(status, body);
    }

    private static Response invalidLevel(String level) {
        return result(OperationResult.failure(Reason.INVALID_LEVEL,
                "Unknown alert level: '" + level + "'. Supported: info, warning, critical"));
    }

    /**
     * @return HTTP status for a failed operation
     */
    static int statusFor(Reason reason) {
        return switch (reason) {
            case OK, ALREADY_STOPPED -> 200;
            case ALREADY_RUNNING, NOT_RUNNING -> 409;
            case UNKNOWN_RULE, UNKNOWN_CHANNEL -> 404;
            case INVALID_RECORD, INVALID_LEVEL -> 400;
            case SUPPRESSED, RATE_LIMITED -> 429;
        };
    }

    // ---------------------------------------------------------------
    // Query parameters
    // ---------------------------------------------------------------

    static Map<String, String> parseQuery(String rawQuery) {
        Map<String, String> params = new HashMap<>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (String pair : rawQuery.split("&")) {
            if (pair.isEmpty()) {
                continue;
            }
            int eq = pair.indexOf('=');
            String key = eq < 0 ? pair : pair.substring(0, eq);
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            params.put(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }

    private static String required(Map<String, String> query, String name) {
        String value = query.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter '" + name + "'");
        }
        return value;
    }

    private static int intParam(Map<String, String> query, String name, int defaultValue) {
        String value = query.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException("Parameter '" + name + "' must be >= 0, got: " + parsed);
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Parameter '" + name + "' must be an integer, got: " + value, e);
        }
    }

    private static boolean boolParam(Map<String, String> query, String name) {
        String value = required(query, name).trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Parameter '" + name + "' must be true or false, got: " + value);
    }
}
