package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.config.ProxyEntryConfig;
import com.tracewire.proxy.config.TracewireProperties;
import com.tracewire.proxy.core.constants.OutputFormat;
import com.tracewire.proxy.core.exceptions.ConfigException;
import com.tracewire.proxy.core.hooks.HookLoader;
import com.tracewire.proxy.core.utils.ValueUtils;
import com.tracewire.proxy.spi.ChunkTransform;
import com.tracewire.proxy.spi.TraceObserver;
import com.tracewire.proxy.spi.TraceWriter;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Builds {@link TcpProxy} instances from configuration entries.
 */
public class TcpProxyFactory {

    private final MeterRegistry registry;

    /**
     * @param registry The Micrometer meter registry proxies register their meters in.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public TcpProxyFactory(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Creates a stopped proxy.
     * 
     * @param portKey    Source port as written in the configuration.
     * @param entry      The proxy entry.
     * @param properties Root configuration supplying defaults and globals.
     * @return A new, unstarted proxy.
     * @throws ConfigException if the entry is invalid or a hook cannot be loaded.
     */
    public TcpProxy create(String portKey, ProxyEntryConfig entry, TracewireProperties properties) {
        return new TcpProxy(define(portKey, entry, properties), registry);
    }

    /**
     * Resolves a configuration entry into a proxy definition.
     * 
     * @param portKey    Source port as written in the configuration.
     * @param entry      The proxy entry.
     * @param properties Root configuration supplying defaults and globals.
     * @return The definition.
     * @throws ConfigException if the entry is invalid or a hook cannot be loaded.
     */
    public ProxyDefinition define(String portKey, ProxyEntryConfig entry, TracewireProperties properties) {
        int port = parsePort(portKey);
        if (entry == null) {
            throw new ConfigException("Proxy on port " + port + " has no settings");
        }

        OutputFormat globalFormat = OutputFormat.parse(properties.getOutputFormat(), OutputFormat.TEXT);
        boolean writeToOutput = entry.getWriteToOutput() != null
                ? entry.getWriteToOutput()
                : properties.isWriteToOutput();
        boolean renderAfterTrace = entry.getRenderAfterTrace() != null
                ? entry.getRenderAfterTrace()
                : properties.isRenderAfterTrace();

        return ProxyDefinition.builder(port)
                .name(entry.getName())
                .description(entry.getDescription())
                .bindAddress(entry.getBindAddress())
                .targets(TargetAddress.parseAll(entry.getTo()))
                .echoPolicy(EchoPolicy.resolve(entry.getReceiveChunksFrom()))
                .chunkTransform(HookLoader.bind(entry.getChunkHandler(), ChunkTransform.class,
                        entry.getChunkHandlerOptions(), entry.getChunkHandlerState()))
                .traceObserver(HookLoader.bind(entry.getTraceHandler(), TraceObserver.class,
                        entry.getTraceHandlerOptions(), entry.getTraceHandlerState()))
                .traceWriter(HookLoader.bind(entry.getTraceWriter(), TraceWriter.class,
                        entry.getTraceWriterOptions(), entry.getTraceWriterState()))
                .outputFormat(OutputFormat.parse(entry.getOutputFormat(), globalFormat))
                .hexWidth(properties.getHexWidth())
                .autoStart(entry.isAutoStart())
                .writeToOutput(writeToOutput)
                .renderAfterTrace(renderAfterTrace)
                .idleTimeout(entry.getIdleTimeout())
                .connectTimeout(entry.getConnectTimeout())
                .globals(properties.getGlobals())
                .build();
    }

    /**
     * @param portKey Port as written in the configuration.
     * @return The port.
     * @throws ConfigException if it is not a valid TCP port.
     */
    public static int parsePort(String portKey) {
        Integer port = ValueUtils.toInteger(portKey);
        if (port == null || port < 1 || port > 65535) {
            throw new ConfigException("Invalid source port: " + portKey);
        }
        return port;
    }
}
