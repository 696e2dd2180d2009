package fr.lapetina.stages.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fr.lapetina.stages.api.dto.StageResponse;
import fr.lapetina.stages.domain.model.DemandMode;
import fr.lapetina.stages.domain.model.Reason;
import fr.lapetina.stages.domain.model.SubscriptionTag;
import fr.lapetina.stages.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.stages.runtime.StageRef;
import fr.lapetina.stages.runtime.StageRuntime;
import fr.lapetina.stages.runtime.StageSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Admin HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET /health - Runtime health and stage count
 * - GET /metrics - Prometheus metrics endpoint
 * - GET /admin/stages - List running stages
 * - GET /admin/stages/{id} - Inspect a stage
 * - POST /admin/stages/{id}/subscriptions/{tag}/cancel - Cancel a subscription
 * - POST /admin/stages/{id}/demand/{forward|accumulate} - Switch demand mode
 */
public final class AdminHttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AdminHttpServer.class);

    private static final Pattern STAGE_PATH = Pattern.compile("^/admin/stages/([^/]+)$");
    private static final Pattern CANCEL_PATH = Pattern.compile("^/admin/stages/([^/]+)/subscriptions/([^/]+)/cancel$");
    private static final Pattern DEMAND_PATH = Pattern.compile("^/admin/stages/([^/]+)/demand/([^/]+)$");

    private final HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final StageRuntime runtime;
    private final MetricsRegistry metricsRegistry;

    public AdminHttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            StageRuntime runtime,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.runtime = runtime;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = HttpServer.create(new InetSocketAddress(host, port), backlog);

        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "admin-http-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/health", new HealthHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("Admin HTTP server configured on {}:{}", host, port);
    }

    public void start() {
        server.start();
        log.info("Admin HTTP server started");
    }

    /**
     * Bound port, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdownNow();
        log.info("Admin HTTP server stopped");
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", "UP");
            health.put("timestamp", System.currentTimeMillis());
            health.put("stages", runtime.getStages().size());

            Map<String, Object> defaults = new LinkedHashMap<>();
            defaults.put("minDemand", runtime.getDefaultMinDemand());
            defaults.put("maxDemand", runtime.getDefaultMaxDemand());
            defaults.put("cancelMode", runtime.getDefaultCancelMode().name());
            health.put("subscriptionDefaults", defaults);

            sendJson(exchange, 200, health);
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, 405, "Method Not Allowed");
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            MDC.put("requestId", UUID.randomUUID().toString());
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                Matcher matcher;
                if (path.equals("/admin/stages") && "GET".equals(method)) {
                    handleListStages(exchange);
                } else if ((matcher = STAGE_PATH.matcher(path)).matches() && "GET".equals(method)) {
                    handleInspectStage(exchange, matcher.group(1));
                } else if ((matcher = CANCEL_PATH.matcher(path)).matches() && "POST".equals(method)) {
                    handleCancel(exchange, matcher.group(1), matcher.group(2));
                } else if ((matcher = DEMAND_PATH.matcher(path)).matches() && "POST".equals(method)) {
                    handleDemandMode(exchange, matcher.group(1), matcher.group(2));
                } else {
                    sendError(exchange, 404, "Not Found");
                }
            } catch (RuntimeException e) {
                log.error("Error in admin handler: path={}", path, e);
                sendError(exchange, 500, e.getMessage());
            } finally {
                MDC.clear();
            }
        }

        private void handleListStages(HttpExchange exchange) throws IOException {
            List<StageResponse> stages = new ArrayList<>();
            for (StageRef stage : runtime.getStages()) {
                stages.add(StageResponse.fromRef(stage));
            }
            sendJson(exchange, 200, stages);
        }

        private void handleInspectStage(HttpExchange exchange, String stageId) throws IOException {
            Optional<StageRef> stage = runtime.findStage(stageId);
            if (stage.isEmpty()) {
                sendError(exchange, 404, "Stage not found: " + stageId);
                return;
            }

            Optional<StageSnapshot> snapshot = runtime.inspect(stage.get());
            if (snapshot.isEmpty()) {
                sendError(exchange, 503, "Stage did not answer: " + stageId);
                return;
            }
            sendJson(exchange, 200, StageResponse.fromSnapshot(snapshot.get()));
        }

        private void handleCancel(HttpExchange exchange, String stageId, String tag) throws IOException {
            Optional<StageRef> stage = runtime.findStage(stageId);
            if (stage.isEmpty()) {
                sendError(exchange, 404, "Stage not found: " + stageId);
                return;
            }

            runtime.cancel(stage.get(), SubscriptionTag.of(tag), Reason.normal("cancelled by admin"));
            log.info("Subscription cancel requested by admin: stage={}, tag={}", stage.get(), tag);
            sendJson(exchange, 202, Map.of(
                    "stage", stageId,
                    "subscription", tag,
                    "action", "cancel"
            ));
        }

        private void handleDemandMode(HttpExchange exchange, String stageId, String modeName) throws IOException {
            DemandMode mode;
            try {
                mode = DemandMode.valueOf(modeName.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                sendError(exchange, 400, "Unknown demand mode: " + modeName + ". Available: forward, accumulate");
                return;
            }

            Optional<StageRef> stage = runtime.findStage(stageId);
            if (stage.isEmpty()) {
                sendError(exchange, 404, "Stage not found: " + stageId);
                return;
            }
            if (!stage.get().getRole().isProducing()) {
                sendError(exchange, 400, "Stage does not produce events: " + stageId);
                return;
            }

            runtime.setDemandMode(stage.get(), mode);
            sendJson(exchange, 202, Map.of(
                    "stage", stageId,
                    "demandMode", mode.name()
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String message) throws IOException {
        Map<String, String> error = Map.of("error", message != null ? message : "unknown error");
        sendJson(exchange, statusCode, error);
    }
}
