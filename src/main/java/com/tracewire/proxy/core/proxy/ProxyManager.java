package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.config.ProxyEntryConfig;
import com.tracewire.proxy.config.TracewireProperties;
import com.tracewire.proxy.core.exceptions.ConfigException;
import com.tracewire.proxy.core.exceptions.ProxyException;
import com.tracewire.proxy.core.services.TraceOutputService;
import com.tracewire.proxy.core.trace.Trace;
import com.tracewire.proxy.core.trace.TraceRenderer;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Orchestrates the configured proxies.
 * Builds them from configuration, applies reloads and runs start, stop and
 * trace commands over one, several or all of them.
 */
public class ProxyManager {

    private static final Logger log = LoggerFactory.getLogger(ProxyManager.class);

    /** Logger receiving rendered trace entries of proxies with {@code writeToOutput}. */
    static final Logger TRACE_LOG = LoggerFactory.getLogger("com.tracewire.proxy.trace");

    private final TracewireProperties properties;
    private final TcpProxyFactory factory;
    private final TraceOutputService traceOutput;
    private final Map<Integer, Managed> proxies = new ConcurrentHashMap<>();
    private Defaults defaults;

    /** A proxy together with the entry it was built from. */
    private record Managed(TcpProxy proxy, ProxyEntryConfig entry) {
    }

    /** Root settings that are baked into every proxy definition. */
    private record Defaults(String outputFormat, int hexWidth, boolean writeToOutput, boolean renderAfterTrace,
            Map<String, Object> globals) {
        static Defaults of(TracewireProperties properties) {
            return new Defaults(properties.getOutputFormat(), properties.getHexWidth(),
                    properties.isWriteToOutput(), properties.isRenderAfterTrace(), properties.getGlobals());
        }
    }

    /**
     * Creates a ProxyManager with the specified configuration and collaborators.
     * 
     * @param properties  Root configuration properties.
     * @param factory     Factory to create proxy instances.
     * @param traceOutput Destination of stopped traces.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public ProxyManager(TracewireProperties properties, TcpProxyFactory factory, TraceOutputService traceOutput) {
        this.properties = properties;
        this.factory = factory;
        this.traceOutput = traceOutput;
    }

    /**
     * Builds all proxies of the initial configuration and starts the ones
     * flagged with {@code autoStart}.
     */
    public void startProxies() {
        refresh(properties);
    }

    /**
     * Updates the set of proxies to match a new configuration.
     * Removed entries are closed, new ones created, and changed ones rebuilt.
     * A rebuilt proxy is started again if it was running before. When the root
     * defaults change every proxy is rebuilt.
     * 
     * @param newProperties The updated configuration.
     */
    public synchronized void refresh(TracewireProperties newProperties) {
        Defaults newDefaults = Defaults.of(newProperties);
        boolean defaultsChanged = defaults != null && !defaults.equals(newDefaults);
        defaults = newDefaults;
        traceOutput.updateProperties(newProperties);

        Map<Integer, ProxyEntryConfig> entries = parseEntries(newProperties);

        // 1. Close proxies that are no longer configured
        for (Integer port : new ArrayList<>(proxies.keySet())) {
            if (!entries.containsKey(port)) {
                log.info("Proxy on port {} removed from configuration", port);
                remove(port);
            }
        }

        // 2. Add or rebuild proxies
        for (Map.Entry<Integer, ProxyEntryConfig> e : entries.entrySet()) {
            Integer port = e.getKey();
            ProxyEntryConfig entry = e.getValue();
            Managed current = proxies.get(port);
            if (current == null) {
                add(port, entry, newProperties, false);
            } else if (defaultsChanged || !current.entry().equals(entry)) {
                log.info("Configuration changed for proxy on port {}. Rebuilding...", port);
                boolean wasRunning = current.proxy().isRunning();
                remove(port);
                add(port, entry, newProperties, wasRunning);
            }
        }
    }

    private Map<Integer, ProxyEntryConfig> parseEntries(TracewireProperties newProperties) {
        Map<Integer, ProxyEntryConfig> entries = new LinkedHashMap<>();
        Map<?, ProxyEntryConfig> configured = newProperties.getProxies();
        if (configured == null) {
            return entries;
        }
        // YAML may hand us integer keys despite the declared String type.
        for (Map.Entry<?, ProxyEntryConfig> e : configured.entrySet()) {
            String key = String.valueOf(e.getKey());
            int port;
            try {
                port = TcpProxyFactory.parsePort(key);
            } catch (ConfigException ex) {
                log.warn("Skipping proxy entry '{}': {}", key, ex.getMessage());
                continue;
            }
            if (entries.putIfAbsent(port, e.getValue()) != null) {
                log.warn("Skipping proxy entry '{}': port {} is configured twice", key, port);
            }
        }
        return entries;
    }

    private void add(int port, ProxyEntryConfig entry, TracewireProperties newProperties, boolean start) {
        TcpProxy proxy;
        try {
            proxy = factory.create(String.valueOf(port), entry, newProperties);
        } catch (ConfigException e) {
            log.error("Invalid configuration for proxy on port {}: {}", port, e.getMessage());
            return;
        }

        if (proxy.getDefinition().isWriteToOutput()) {
            TraceRenderer renderer = new TraceRenderer(proxy.getName(), proxy.getDefinition().getHexWidth());
            proxy.addTraceListener((traceEntry, recording) -> {
                if (recording) {
                    TRACE_LOG.info(renderer.renderEntry(traceEntry));
                }
            });
        }

        proxies.put(port, new Managed(proxy, entry));
        log.info("Created proxy '{}' on port {}", proxy.getName(), port);

        if (start || proxy.getDefinition().isAutoStart()) {
            start(proxy);
        }
    }

    private void remove(int port) {
        Managed managed = proxies.remove(port);
        if (managed != null) {
            shutdown(managed.proxy());
        }
    }

    private void shutdown(TcpProxy proxy) {
        try {
            if (proxy.isTracing()) {
                toggleTrace(proxy);
            }
            proxy.close();
        } catch (Exception e) {
            log.error("Error closing proxy '{}': {}", proxy.getName(), e.getMessage());
        }
    }

    /**
     * Resolves command arguments into proxies. {@code all} or {@code *} selects
     * every proxy; other tokens are matched against ports, then names.
     * 
     * @param tokens Ports, names or {@code all}.
     * @return The selected proxies in port order, without duplicates.
     */
    public List<TcpProxy> select(Collection<String> tokens) {
        Set<TcpProxy> selected = new LinkedHashSet<>();
        for (String token : tokens) {
            if ("all".equalsIgnoreCase(token) || "*".equals(token)) {
                selected.addAll(getProxies());
                continue;
            }
            TcpProxy match = find(token);
            if (match != null) {
                selected.add(match);
            } else {
                log.warn("No proxy matches '{}'", token);
            }
        }
        List<TcpProxy> result = new ArrayList<>(selected);
        result.sort(Comparator.comparingInt(TcpProxy::getPort));
        return result;
    }

    private TcpProxy find(String token) {
        try {
            TcpProxy byPort = getProxy(Integer.parseInt(token.trim()));
            if (byPort != null) {
                return byPort;
            }
        } catch (NumberFormatException ignored) {
            // not a port, try names
        }
        return getProxies().stream()
                .filter(p -> p.getName().equalsIgnoreCase(token.trim()))
                .findFirst()
                .orElse(null);
    }

    /**
     * @param proxy The proxy.
     * @return {@code true} if the proxy was started.
     */
    public boolean start(TcpProxy proxy) {
        try {
            return proxy.start();
        } catch (ProxyException e) {
            log.error("Failed to start proxy '{}': {}", proxy.getName(), e.getMessage());
            return false;
        }
    }

    /**
     * @param proxy The proxy.
     * @return {@code true} if the proxy was stopped.
     */
    public boolean stop(TcpProxy proxy) {
        return proxy.stop();
    }

    /**
     * Starts a stopped proxy or stops a running one.
     * 
     * @param proxy The proxy.
     * @return {@code true} if the proxy is running afterwards.
     */
    public boolean toggle(TcpProxy proxy) {
        if (proxy.isRunning()) {
            stop(proxy);
            return false;
        }
        return start(proxy);
    }

    /**
     * Toggles tracing. A trace that stops is published through the
     * {@link TraceOutputService}.
     * 
     * @param proxy The proxy.
     * @return The new active trace, or the stopped trace.
     */
    public Trace toggleTrace(TcpProxy proxy) {
        Trace trace = proxy.toggleTrace();
        if (!trace.isActive()) {
            traceOutput.publish(proxy.getDefinition(), trace);
        }
        return trace;
    }

    /**
     * @return All proxies in port order.
     */
    public List<TcpProxy> getProxies() {
        List<TcpProxy> result = new ArrayList<>();
        proxies.values().forEach(m -> result.add(m.proxy()));
        result.sort(Comparator.comparingInt(TcpProxy::getPort));
        return result;
    }

    /**
     * @param port Source port.
     * @return The proxy on that port, or {@code null}.
     */
    public TcpProxy getProxy(int port) {
        Managed managed = proxies.get(port);
        return managed != null ? managed.proxy() : null;
    }

    /**
     * @return Status of every proxy in port order.
     */
    public List<ProxyStatus> status() {
        return getProxies().stream().map(ProxyStatus::of).toList();
    }

    /**
     * Publishes active traces and closes every proxy.
     */
    public synchronized void stopAll() {
        log.info("Stopping all proxies...");
        for (Integer port : new ArrayList<>(proxies.keySet())) {
            remove(port);
        }
        defaults = null;
    }
}
