package com.tracewire.proxy.config;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root configuration object for Tracewire.
 * Maps to the top-level structure of application.yml.
 */
public class TracewireProperties {
    /**
     * Proxy entries keyed by source port. Keys are kept as written in the
     * configuration; entries whose key is not a valid port are skipped when
     * the proxies are built.
     */
    private Map<String, ProxyEntryConfig> proxies;

    /** Default output format for rendered traces (ascii, http, json, text). */
    private String outputFormat = "text";

    /** Number of bytes per hex dump row in the text format. */
    private int hexWidth = 16;

    /** Whether new trace entries are logged while tracing. */
    private boolean writeToOutput = false;

    /** Whether a stopped trace is rendered into {@link #traceOutputPath}. */
    private boolean renderAfterTrace = true;

    /** Directory rendered traces are written to. */
    private String traceOutputPath = "traces";

    /** Free-form values handed to every hook of every proxy. */
    private Map<String, Object> globals;

    /**
     * Administration and metrics configuration.
     */
    private AdminConfig admin = new AdminConfig();

    public Map<String, ProxyEntryConfig> getProxies() {
        return proxies == null ? null : Collections.unmodifiableMap(proxies);
    }

    public void setProxies(Map<String, ProxyEntryConfig> proxies) {
        this.proxies = proxies == null ? null : new LinkedHashMap<>(proxies);
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public int getHexWidth() {
        return hexWidth;
    }

    public void setHexWidth(int hexWidth) {
        this.hexWidth = hexWidth;
    }

    public boolean isWriteToOutput() {
        return writeToOutput;
    }

    public void setWriteToOutput(boolean writeToOutput) {
        this.writeToOutput = writeToOutput;
    }

    public boolean isRenderAfterTrace() {
        return renderAfterTrace;
    }

    public void setRenderAfterTrace(boolean renderAfterTrace) {
        this.renderAfterTrace = renderAfterTrace;
    }

    public String getTraceOutputPath() {
        return traceOutputPath;
    }

    public void setTraceOutputPath(String traceOutputPath) {
        this.traceOutputPath = traceOutputPath;
    }

    public Map<String, Object> getGlobals() {
        return globals == null ? null : Collections.unmodifiableMap(globals);
    }

    public void setGlobals(Map<String, Object> globals) {
        this.globals = globals == null ? null : new LinkedHashMap<>(globals);
    }

    @SuppressFBWarnings("EI_EXPOSE_REP")
    public AdminConfig getAdmin() {
        return admin;
    }

    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public void setAdmin(AdminConfig admin) {
        this.admin = admin;
    }
}
