package com.tracewire.proxy;

import com.tracewire.proxy.config.ConfigLoader;
import com.tracewire.proxy.config.TracewireProperties;
import com.tracewire.proxy.core.exceptions.ConfigException;
import com.tracewire.proxy.core.exceptions.ProxyException;
import com.tracewire.proxy.core.proxy.ProxyManager;
import com.tracewire.proxy.core.proxy.ProxyStatus;
import com.tracewire.proxy.core.proxy.TcpProxy;
import com.tracewire.proxy.core.proxy.TcpProxyFactory;
import com.tracewire.proxy.core.services.MetricsService;
import com.tracewire.proxy.core.services.TraceOutputService;
import com.tracewire.proxy.core.trace.Trace;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.NoSuchElementException;
import java.util.Scanner;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Tracewire Proxy application.
 * Handles command-line arguments, configuration loading, the interactive
 * console and the application lifecycle.
 */
@Command(name = "tracewire-proxy", mixinStandardHelpOptions = true, version = "1.0.0", description = "TCP port-forwarding proxy with multi-target fan-out and traffic tracing.")
public class TracewireProxyApplication implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(TracewireProxyApplication.class);

    private static final String HELP = "Available commands: start <ports|all>, stop <ports|all>, "
            + "toggle <ports|all>, trace <ports|all>, status, reload, help, exit, quit";

    /**
     * Path to the YAML configuration file.
     */
    @Option(names = { "-c", "--config" }, description = "Path to config file (YAML)", defaultValue = "application.yml")
    private String configPath;

    private ProxyManager proxyManager;
    private MetricsService metricsService;
    private TraceOutputService traceOutputService;

    /** Latch to block the main thread until shutdown is triggered. */
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    /** Flag to signal background threads to stop. */
    private final AtomicBoolean running = new AtomicBoolean(true);

    /**
     * Service to watch for configuration file changes.
     * Assigned once by the watcher thread, read during shutdown.
     */
    private volatile WatchService watchService;

    /** Reference to the registered shutdown hook for cleanup. */
    private Thread shutdownHook;

    /**
     * Main method to launch the application.
     * 
     * @param args Command-line arguments.
     */
    public static void main(String[] args) {
        new CommandLine(new TracewireProxyApplication()).execute(args);
    }

    /**
     * Bootstraps the application, builds the proxies, and sets up configuration
     * watching and the console.
     * 
     * @return Exit code (0 for success, 1 for failure).
     */
    @Override
    public Integer call() {
        try {
            log.info("Starting Tracewire Proxy...");

            TracewireProperties props = ConfigLoader.load(configPath);
            this.metricsService = new MetricsService(props);
            this.traceOutputService = new TraceOutputService(props);

            TcpProxyFactory factory = new TcpProxyFactory(metricsService.getRegistry());
            this.proxyManager = new ProxyManager(props, factory, traceOutputService);
            metricsService.setStatusSupplier(proxyManager::status);

            proxyManager.startProxies();

            startFileWatcher();
            if (System.getProperty("tracewire.no-command-listener") == null) {
                startCommandListener();
            }

            if (System.getProperty("tracewire.no-shutdown-hook") == null) {
                this.shutdownHook = new Thread(this::stop, "ShutdownHook");
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            }

            shutdownLatch.await();
            return 0;
        } catch (ConfigException e) {
            log.error("Configuration Error: {}", e.getMessage());
            return 1;
        } catch (ProxyException e) {
            log.error("Fatal proxy error: {}", e.getMessage());
            return 1;
        } catch (InterruptedException e) {
            log.warn("Application interrupted");
            Thread.currentThread().interrupt();
            return 0;
        } catch (Exception e) {
            log.error("Unexpected fatal error", e);
            return 1;
        } finally {
            stop();
        }
    }

    /**
     * Starts an interactive command listener on System.in.
     */
    private void startCommandListener() {
        Thread listener = new Thread(() -> {
            try (Scanner scanner = new Scanner(System.in, StandardCharsets.UTF_8)) {
                log.info("Interactive console ready. Type 'help' for available commands.");
                while (running.get() && readAndProcessCommand(scanner)) {
                    // Loop continues as long as input is available and stop hasn't been signaled
                }
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("Command listener fatal error: {}", e.getMessage(), e);
                }
            }
        }, "CommandListener");
        listener.setDaemon(true);
        listener.start();
    }

    /**
     * Reads and processes the next command from the scanner.
     * 
     * @param scanner Input scanner.
     * @return True if a command was processed, false if input was closed.
     */
    private boolean readAndProcessCommand(Scanner scanner) {
        try {
            if (scanner.hasNextLine()) {
                processCommand(scanner.nextLine());
                return true;
            }
        } catch (NoSuchElementException e) {
            log.debug("Console input closed");
        }
        return false;
    }

    /**
     * Processes a single interactive command, e.g. {@code trace 8080 8081}.
     * 
     * @param line The command line.
     */
    void processCommand(String line) {
        String[] words = line.trim().split("\\s+");
        String command = words[0].toLowerCase(Locale.ROOT);
        if (command.isEmpty()) {
            return;
        }
        List<String> args = Arrays.asList(words).subList(1, words.length);

        switch (command) {
            case "start" -> forEachSelected(args, command, p -> proxyManager.start(p) ? "started" : "not started");
            case "stop" -> forEachSelected(args, command, p -> proxyManager.stop(p) ? "stopped" : "not running");
            case "toggle" -> forEachSelected(args, command, p -> proxyManager.toggle(p) ? "running" : "stopped");
            case "trace" -> forEachSelected(args, command, this::toggleTrace);
            case "status" -> printStatus();
            case "reload" -> reloadConfiguration();
            case "exit", "quit" -> stop();
            case "help" -> log.info(HELP);
            default -> log.warn("Unknown command: {}. Type 'help' for available commands.", command);
        }
    }

    private void forEachSelected(List<String> args, String command,
            Function<TcpProxy, String> action) {
        if (args.isEmpty()) {
            log.warn("Usage: {} <ports|names|all>", command);
            return;
        }
        List<TcpProxy> selected = proxyManager.select(args);
        for (TcpProxy proxy : selected) {
            log.info("{} '{}' (port {}): {}", command, proxy.getName(), proxy.getPort(), action.apply(proxy));
        }
    }

    private String toggleTrace(TcpProxy proxy) {
        Trace trace = proxyManager.toggleTrace(proxy);
        return trace.isActive() ? "tracing" : "trace stopped with " + trace.size() + " entries";
    }

    private void printStatus() {
        List<ProxyStatus> status = proxyManager.status();
        if (status.isEmpty()) {
            log.info("No proxies configured");
        }
        status.forEach(s -> log.info(s.describe()));
    }

    ProxyManager getProxyManager() {
        return proxyManager;
    }

    /**
     * Gracefully stops all proxies, the configuration watcher, and background
     * listeners.
     * Also unregisters the shutdown hook to prevent leaks in test
     * environments.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down Tracewire Proxy...");

            unregisterShutdownHook();

            if (proxyManager != null) {
                proxyManager.stopAll();
            }
            if (metricsService != null) {
                metricsService.shutdown();
            }
            closeWatchService();
            shutdownLatch.countDown();
        }
    }

    /**
     * Unregisters the JVM shutdown hook safely.
     */
    private void unregisterShutdownHook() {
        if (shutdownHook != null) {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // Expected when stop() runs inside the hook itself
                log.trace("Shutdown in progress: {}", e.getMessage());
            }
        }
    }

    /**
     * Closes the configuration file watch service.
     */
    private void closeWatchService() {
        WatchService service = watchService;
        if (service != null) {
            try {
                service.close();
            } catch (Exception e) {
                log.debug("Failed to close watch service: {}", e.getMessage());
            }
        }
    }

    /**
     * Reloads the configuration from disk and refreshes the proxies.
     */
    private void reloadConfiguration() {
        try {
            log.info("Reloading configuration from {}...", configPath);
            TracewireProperties newProps = ConfigLoader.load(configPath);

            this.metricsService.updateProperties(newProps);
            proxyManager.refresh(newProps);
            log.info("Configuration reloaded successfully.");
        } catch (Exception e) {
            log.error("Failed to reload configuration: {}", e.getMessage());
        }
    }

    /**
     * Starts a background thread to watch for changes in the configuration file.
     * Uses a debounce mechanism to avoid multiple reloads for a single logical
     * change.
     */
    private void startFileWatcher() {
        Thread watcherThread = new Thread(() -> {
            try {
                Path path = Paths.get(configPath).toAbsolutePath();
                Path parent = path.getParent();
                if (parent == null || !parent.toFile().isDirectory()) {
                    return;
                }

                WatchService service = FileSystems.getDefault().newWatchService();
                this.watchService = service;
                if (!running.get()) {
                    service.close();
                    return;
                }
                parent.register(service, StandardWatchEventKinds.ENTRY_MODIFY, StandardWatchEventKinds.ENTRY_CREATE);

                log.info("Watching configuration file for changes: {}", path);
                runWatcherLoop(service, path.getFileName().toString());
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
            } catch (InterruptedException e) {
                log.debug("File watcher interrupted");
                Thread.currentThread().interrupt();
            } catch (Exception e) {
                if (running.get()) {
                    log.warn("File watcher error: {}", e.getMessage(), e);
                }
            }
        }, "ConfigWatcher");
        watcherThread.setDaemon(true);
        watcherThread.start();
    }

    /**
     * Executes the main loop for the configuration file watcher.
     * 
     * @param service  The watch service.
     * @param fileName The name of the file to watch.
     * @throws InterruptedException If the thread is interrupted.
     */
    private void runWatcherLoop(WatchService service, String fileName) throws InterruptedException {
        // Debounce: reload only after 1s without further events.
        final long debounceNanos = 1_000_000_000L;
        long lastEventNano = 0;

        while (running.get()) {
            WatchKey key = service.poll(500, TimeUnit.MILLISECONDS);
            if (key != null) {
                for (WatchEvent<?> event : key.pollEvents()) {
                    if (event.context() != null && event.context().toString().equals(fileName)) {
                        lastEventNano = System.nanoTime();
                    }
                }
                if (!key.reset()) {
                    break;
                }
            }

            if (lastEventNano > 0 && System.nanoTime() - lastEventNano >= debounceNanos) {
                lastEventNano = 0;
                reloadConfiguration();
            }
        }
    }
}
