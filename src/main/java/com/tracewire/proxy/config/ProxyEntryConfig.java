package com.tracewire.proxy.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for the proxy bound to one source port.
 * <p>
 * A few fields accept several YAML shapes: {@code to} is a single target or a
 * list of targets (an integer port or a {@code host:port} string), and
 * {@code receiveChunksFrom} is a boolean, a target index or a list of target
 * indexes. They are normalized when the proxy definition is built.
 * </p>
 */
public class ProxyEntryConfig {
    /** Display name. Defaults to the port. */
    private String name;

    /** Free text shown in the status output. */
    private String description;

    /** One or more targets. */
    private Object to;

    /** Which targets' responses are written back to the client. */
    private Object receiveChunksFrom;

    /** Identifier of the chunk transform hook. */
    private String chunkHandler;
    private Map<String, Object> chunkHandlerOptions;
    private Object chunkHandlerState;

    /** Identifier of the trace observer hook. */
    private String traceHandler;
    private Map<String, Object> traceHandlerOptions;
    private Object traceHandlerState;

    /** Identifier of the trace writer hook. */
    private String traceWriter;
    private Map<String, Object> traceWriterOptions;
    private Object traceWriterState;

    /** Output format of rendered traces. Falls back to the global setting. */
    private String outputFormat;

    /** Whether the proxy is started as soon as it is created. */
    private boolean autoStart = false;

    /** Overrides the global writeToOutput flag when set. */
    private Boolean writeToOutput;

    /** Overrides the global renderAfterTrace flag when set. */
    private Boolean renderAfterTrace;

    /** Local IP address to bind to. Null means all interfaces. */
    private String bindAddress;

    /** Idle read timeout of every leg in milliseconds. 0 disables it. */
    private int idleTimeout = 0;

    /** Connect timeout for target connections in milliseconds. */
    private int connectTimeout = 10000;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public Object getTo() {
        return to;
    }

    public void setTo(Object to) {
        this.to = to;
    }

    public Object getReceiveChunksFrom() {
        return receiveChunksFrom;
    }

    public void setReceiveChunksFrom(Object receiveChunksFrom) {
        this.receiveChunksFrom = receiveChunksFrom;
    }

    public String getChunkHandler() {
        return chunkHandler;
    }

    public void setChunkHandler(String chunkHandler) {
        this.chunkHandler = chunkHandler;
    }

    public Map<String, Object> getChunkHandlerOptions() {
        return unmodifiable(chunkHandlerOptions);
    }

    public void setChunkHandlerOptions(Map<String, Object> chunkHandlerOptions) {
        this.chunkHandlerOptions = copy(chunkHandlerOptions);
    }

    public Object getChunkHandlerState() {
        return chunkHandlerState;
    }

    public void setChunkHandlerState(Object chunkHandlerState) {
        this.chunkHandlerState = chunkHandlerState;
    }

    public String getTraceHandler() {
        return traceHandler;
    }

    public void setTraceHandler(String traceHandler) {
        this.traceHandler = traceHandler;
    }

    public Map<String, Object> getTraceHandlerOptions() {
        return unmodifiable(traceHandlerOptions);
    }

    public void setTraceHandlerOptions(Map<String, Object> traceHandlerOptions) {
        this.traceHandlerOptions = copy(traceHandlerOptions);
    }

    public Object getTraceHandlerState() {
        return traceHandlerState;
    }

    public void setTraceHandlerState(Object traceHandlerState) {
        this.traceHandlerState = traceHandlerState;
    }

    public String getTraceWriter() {
        return traceWriter;
    }

    public void setTraceWriter(String traceWriter) {
        this.traceWriter = traceWriter;
    }

    public Map<String, Object> getTraceWriterOptions() {
        return unmodifiable(traceWriterOptions);
    }

    public void setTraceWriterOptions(Map<String, Object> traceWriterOptions) {
        this.traceWriterOptions = copy(traceWriterOptions);
    }

    public Object getTraceWriterState() {
        return traceWriterState;
    }

    public void setTraceWriterState(Object traceWriterState) {
        this.traceWriterState = traceWriterState;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Boolean getWriteToOutput() {
        return writeToOutput;
    }

    public void setWriteToOutput(Boolean writeToOutput) {
        this.writeToOutput = writeToOutput;
    }

    public Boolean getRenderAfterTrace() {
        return renderAfterTrace;
    }

    public void setRenderAfterTrace(Boolean renderAfterTrace) {
        this.renderAfterTrace = renderAfterTrace;
    }

    public String getBindAddress() {
        return bindAddress;
    }

    public void setBindAddress(String bindAddress) {
        this.bindAddress = bindAddress;
    }

    public int getIdleTimeout() {
        return idleTimeout;
    }

    public void setIdleTimeout(int idleTimeout) {
        this.idleTimeout = idleTimeout;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? null : new LinkedHashMap<>(source);
    }

    private static Map<String, Object> unmodifiable(Map<String, Object> source) {
        return source == null ? null : Collections.unmodifiableMap(source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ProxyEntryConfig that = (ProxyEntryConfig) o;
        return autoStart == that.autoStart &&
               idleTimeout == that.idleTimeout &&
               connectTimeout == that.connectTimeout &&
               Objects.equals(name, that.name) &&
               Objects.equals(description, that.description) &&
               Objects.equals(to, that.to) &&
               Objects.equals(receiveChunksFrom, that.receiveChunksFrom) &&
               Objects.equals(chunkHandler, that.chunkHandler) &&
               Objects.equals(chunkHandlerOptions, that.chunkHandlerOptions) &&
               Objects.equals(chunkHandlerState, that.chunkHandlerState) &&
               Objects.equals(traceHandler, that.traceHandler) &&
               Objects.equals(traceHandlerOptions, that.traceHandlerOptions) &&
               Objects.equals(traceHandlerState, that.traceHandlerState) &&
               Objects.equals(traceWriter, that.traceWriter) &&
               Objects.equals(traceWriterOptions, that.traceWriterOptions) &&
               Objects.equals(traceWriterState, that.traceWriterState) &&
               Objects.equals(outputFormat, that.outputFormat) &&
               Objects.equals(writeToOutput, that.writeToOutput) &&
               Objects.equals(renderAfterTrace, that.renderAfterTrace) &&
               Objects.equals(bindAddress, that.bindAddress);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, to, receiveChunksFrom, chunkHandler, chunkHandlerOptions,
                chunkHandlerState, traceHandler, traceHandlerOptions, traceHandlerState, traceWriter,
                traceWriterOptions, traceWriterState, outputFormat, autoStart, writeToOutput, renderAfterTrace,
                bindAddress, idleTimeout, connectTimeout);
    }
}
