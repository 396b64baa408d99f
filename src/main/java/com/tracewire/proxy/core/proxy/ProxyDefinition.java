package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.constants.OutputFormat;
import com.tracewire.proxy.core.exceptions.ConfigException;
import com.tracewire.proxy.core.hooks.HookBinding;
import com.tracewire.proxy.core.trace.TraceRenderer;
import com.tracewire.proxy.core.utils.ValueUtils;
import com.tracewire.proxy.spi.ChunkTransform;
import com.tracewire.proxy.spi.TraceObserver;
import com.tracewire.proxy.spi.TraceWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved, immutable configuration of one {@link TcpProxy}. Only the state
 * cells of the hook bindings change over the proxy's lifetime.
 */
public final class ProxyDefinition {

    private final int port;
    private final String name;
    private final String description;
    private final String bindAddress;
    private final List<TargetAddress> targets;
    private final EchoPolicy echoPolicy;
    private final HookBinding<ChunkTransform> chunkTransform;
    private final HookBinding<TraceObserver> traceObserver;
    private final HookBinding<TraceWriter> traceWriter;
    private final OutputFormat outputFormat;
    private final int hexWidth;
    private final boolean autoStart;
    private final boolean writeToOutput;
    private final boolean renderAfterTrace;
    private final int idleTimeout;
    private final int connectTimeout;
    private final Map<String, Object> globals;

    private ProxyDefinition(Builder builder) {
        this.port = builder.port;
        this.name = builder.name != null && !builder.name.isBlank() ? builder.name.trim() : "Proxy " + builder.port;
        this.description = builder.description;
        this.bindAddress = builder.bindAddress;
        this.targets = List.copyOf(builder.targets);
        this.echoPolicy = builder.echoPolicy;
        this.chunkTransform = builder.chunkTransform;
        this.traceObserver = builder.traceObserver;
        this.traceWriter = builder.traceWriter;
        this.outputFormat = builder.outputFormat;
        this.hexWidth = builder.hexWidth;
        this.autoStart = builder.autoStart;
        this.writeToOutput = builder.writeToOutput;
        this.renderAfterTrace = builder.renderAfterTrace;
        this.idleTimeout = builder.idleTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.globals = ValueUtils.immutableCopy(builder.globals);
    }

    /**
     * @param port Source port the proxy listens on.
     * @return A builder with defaults for everything but the port.
     */
    public static Builder builder(int port) {
        return new Builder(port);
    }

    public int getPort() {
        return port;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public List<TargetAddress> getTargets() {
        return targets;
    }

    public EchoPolicy getEchoPolicy() {
        return echoPolicy;
    }

    public HookBinding<ChunkTransform> getChunkTransform() {
        return chunkTransform;
    }

    public HookBinding<TraceObserver> getTraceObserver() {
        return traceObserver;
    }

    public HookBinding<TraceWriter> getTraceWriter() {
        return traceWriter;
    }

    public OutputFormat getOutputFormat() {
        return outputFormat;
    }

    public int getHexWidth() {
        return hexWidth;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public boolean isWriteToOutput() {
        return writeToOutput;
    }

    public boolean isRenderAfterTrace() {
        return renderAfterTrace;
    }

    public int getIdleTimeout() {
        return idleTimeout;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * @return Root globals handed to every hook, unmodifiable.
     */
    public Map<String, Object> getGlobals() {
        return globals;
    }

    /**
     * Builder for {@link ProxyDefinition}.
     */
    public static final class Builder {
        private final int port;
        private String name;
        private String description;
        private String bindAddress;
        private final List<TargetAddress> targets = new ArrayList<>();
        private EchoPolicy echoPolicy = EchoPolicy.firstTarget();
        private HookBinding<ChunkTransform> chunkTransform;
        private HookBinding<TraceObserver> traceObserver;
        private HookBinding<TraceWriter> traceWriter;
        private OutputFormat outputFormat = OutputFormat.TEXT;
        private int hexWidth = TraceRenderer.DEFAULT_HEX_WIDTH;
        private boolean autoStart;
        private boolean writeToOutput;
        private boolean renderAfterTrace = true;
        private int idleTimeout;
        private int connectTimeout = 10000;
        private Map<String, Object> globals;

        private Builder(int port) {
            if (port < 0 || port > 65535) {
                throw new ConfigException("Invalid source port: " + port);
            }
            this.port = port;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder bindAddress(String bindAddress) {
            this.bindAddress = bindAddress;
            return this;
        }

        public Builder target(TargetAddress target) {
            this.targets.add(Objects.requireNonNull(target, "target"));
            return this;
        }

        public Builder targets(List<TargetAddress> targets) {
            targets.forEach(this::target);
            return this;
        }

        public Builder echoPolicy(EchoPolicy echoPolicy) {
            this.echoPolicy = Objects.requireNonNull(echoPolicy, "echoPolicy");
            return this;
        }

        public Builder chunkTransform(HookBinding<ChunkTransform> chunkTransform) {
            this.chunkTransform = chunkTransform;
            return this;
        }

        public Builder traceObserver(HookBinding<TraceObserver> traceObserver) {
            this.traceObserver = traceObserver;
            return this;
        }

        public Builder traceWriter(HookBinding<TraceWriter> traceWriter) {
            this.traceWriter = traceWriter;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = Objects.requireNonNull(outputFormat, "outputFormat");
            return this;
        }

        public Builder hexWidth(int hexWidth) {
            this.hexWidth = hexWidth > 0 ? hexWidth : TraceRenderer.DEFAULT_HEX_WIDTH;
            return this;
        }

        public Builder autoStart(boolean autoStart) {
            this.autoStart = autoStart;
            return this;
        }

        public Builder writeToOutput(boolean writeToOutput) {
            this.writeToOutput = writeToOutput;
            return this;
        }

        public Builder renderAfterTrace(boolean renderAfterTrace) {
            this.renderAfterTrace = renderAfterTrace;
            return this;
        }

        public Builder idleTimeout(int idleTimeout) {
            this.idleTimeout = Math.max(0, idleTimeout);
            return this;
        }

        public Builder connectTimeout(int connectTimeout) {
            this.connectTimeout = Math.max(0, connectTimeout);
            return this;
        }

        public Builder globals(Map<String, Object> globals) {
            this.globals = globals;
            return this;
        }

        /**
         * @return The definition.
         * @throws ConfigException if no target was added.
         */
        public ProxyDefinition build() {
            if (targets.isEmpty()) {
                throw new ConfigException("Proxy on port " + port + " has no target");
            }
            return new ProxyDefinition(this);
        }
    }
}
