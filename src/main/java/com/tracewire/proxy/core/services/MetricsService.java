package com.tracewire.proxy.core.services;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.tracewire.proxy.config.AdminConfig;
import com.tracewire.proxy.config.TracewireProperties;
import com.tracewire.proxy.core.proxy.ProxyStatus;
import com.tracewire.proxy.core.utils.JsonSupport;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Service providing application metrics via Micrometer and a simple HTTP admin
 * server with {@code /health}, {@code /metrics} and {@code /proxies}.
 */
public class MetricsService {
    private static final Logger log = LoggerFactory.getLogger(MetricsService.class);
    private final PrometheusMeterRegistry registry;
    private HttpServer adminServer;
    private ExecutorService adminExecutor;
    private AdminConfig config;
    private volatile Supplier<List<ProxyStatus>> statusSupplier = List::of;

    public MetricsService(TracewireProperties properties) {
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        this.config = adminOf(properties);
        setupAdminServer();
    }

    private synchronized void setupAdminServer() {
        if (!config.isEnabled()) {
            return;
        }

        try {
            this.adminServer = HttpServer.create(new InetSocketAddress(config.getBindAddress(), config.getPort()), 0);

            // Health check endpoint
            adminServer.createContext("/health", exchange -> respond(exchange, "OK", "text/plain"));

            // Metrics endpoint (Prometheus format)
            adminServer.createContext("/metrics",
                    exchange -> respond(exchange, registry.scrape(), "text/plain; version=0.0.4"));

            // Proxy status as JSON
            adminServer.createContext("/proxies",
                    exchange -> respond(exchange, JsonSupport.toPrettyJson(statusSupplier.get()),
                            "application/json"));

            this.adminExecutor = Executors.newCachedThreadPool(runnable -> {
                Thread thread = new Thread(runnable, "admin-http");
                thread.setDaemon(true);
                return thread;
            });
            adminServer.setExecutor(adminExecutor);
            adminServer.start();
            log.info("Admin server started on port {} (/health, /metrics, /proxies)", getAdminPort());
        } catch (IOException e) {
            log.error("Failed to start admin server: {}", e.getMessage());
            adminServer = null;
        }
    }

    private static void respond(HttpExchange exchange, String body, String contentType) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public MeterRegistry getRegistry() {
        return registry;
    }

    /**
     * @param statusSupplier Source of the {@code /proxies} response.
     */
    public void setStatusSupplier(Supplier<List<ProxyStatus>> statusSupplier) {
        this.statusSupplier = Objects.requireNonNull(statusSupplier);
    }

    /**
     * @return The bound admin port, or -1 if the admin server is not running.
     */
    public synchronized int getAdminPort() {
        return adminServer != null ? adminServer.getAddress().getPort() : -1;
    }

    public void updateProperties(TracewireProperties properties) {
        AdminConfig newConfig = adminOf(properties);
        if (newConfig.isEnabled() != config.isEnabled() || newConfig.getPort() != config.getPort()
                || !Objects.equals(newConfig.getBindAddress(), config.getBindAddress())) {
            shutdown();
            this.config = newConfig;
            setupAdminServer();
        }
    }

    private static AdminConfig adminOf(TracewireProperties properties) {
        return properties.getAdmin() != null ? properties.getAdmin() : new AdminConfig();
    }

    public synchronized void shutdown() {
        if (adminServer != null) {
            log.info("Stopping admin server...");
            adminServer.stop(0);
            adminServer = null;
        }
        if (adminExecutor != null) {
            adminExecutor.shutdownNow();
            adminExecutor = null;
        }
    }
}
