package io.histingest.admin;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Histogram;
import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.histingest.core.Json;
import io.histingest.state.OperationSnapshot;
import io.histingest.state.OperationStateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Read-only HTTP view of job snapshots and metrics.
 * <ul>
 *   <li>{@code GET /jobs} all known job snapshots</li>
 *   <li>{@code GET /jobs/<id>} one snapshot, 404 when unknown</li>
 *   <li>{@code GET /metrics} counters, meters and timers as JSON</li>
 *   <li>{@code GET /health} liveness</li>
 * </ul>
 */
public class StatusServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(StatusServer.class);

    private final HttpServer server;
    private final ExecutorService executor;
    private final OperationStateStore store;
    private final MetricRegistry registry;
    private final ObjectMapper mapper = Json.mapper();

    public StatusServer(int port, OperationStateStore store, MetricRegistry registry) throws IOException {
        this.store = store;
        this.registry = registry;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newCachedThreadPool();
        server.createContext("/jobs", new JobsHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/health", exchange -> send(exchange, 200, Map.of("status", "ok")));
        server.setExecutor(executor);
    }

    public void start() {
        server.start();
        log.info("Status server listening on port {}", port());
    }

    public int port() { return server.getAddress().getPort(); }

    @Override
    public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    private class JobsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                exchange.sendResponseHeaders(405, -1);
                exchange.close();
                return;
            }
            String path = exchange.getRequestURI().getPath();
            String rest = path.length() > "/jobs".length() ? path.substring("/jobs".length() + 1) : "";
            try {
                if (rest.isEmpty()) {
                    send(exchange, 200, store.list());
                    return;
                }
                Optional<OperationSnapshot> snapshot = store.get(rest);
                if (snapshot.isPresent()) {
                    send(exchange, 200, snapshot.get());
                } else {
                    send(exchange, 404, Map.of("error", "unknown job " + rest));
                }
            } catch (IOException e) {
                log.warn("Failed to read job state: {}", e.getMessage());
                send(exchange, 500, Map.of("error", String.valueOf(e.getMessage())));
            }
        }
    }

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Map<String, Object> out = new LinkedHashMap<>();
            Map<String, Object> counters = new LinkedHashMap<>();
            for (Map.Entry<String, Counter> e : registry.getCounters().entrySet()) {
                counters.put(e.getKey(), e.getValue().getCount());
            }
            Map<String, Object> meters = new LinkedHashMap<>();
            for (Map.Entry<String, Meter> e : registry.getMeters().entrySet()) {
                meters.put(e.getKey(), Map.of("count", e.getValue().getCount(), "m1_rate", e.getValue().getOneMinuteRate()));
            }
            Map<String, Object> timers = new LinkedHashMap<>();
            for (Map.Entry<String, Timer> e : registry.getTimers().entrySet()) {
                Snapshot s = e.getValue().getSnapshot();
                timers.put(e.getKey(), Map.of("count", e.getValue().getCount(),
                        "p50_ms", s.getMedian() / 1_000_000.0, "p99_ms", s.get99thPercentile() / 1_000_000.0));
            }
            Map<String, Object> histograms = new LinkedHashMap<>();
            for (Map.Entry<String, Histogram> e : registry.getHistograms().entrySet()) {
                Snapshot s = e.getValue().getSnapshot();
                histograms.put(e.getKey(), Map.of("count", e.getValue().getCount(), "p50", s.getMedian(), "max", s.getMax()));
            }
            out.put("counters", counters);
            out.put("meters", meters);
            out.put("timers", timers);
            out.put("histograms", histograms);
            send(exchange, 200, out);
        }
    }

    private void send(HttpExchange exchange, int status, Object body) throws IOException {
        byte[] bytes = mapper.writeValueAsString(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
