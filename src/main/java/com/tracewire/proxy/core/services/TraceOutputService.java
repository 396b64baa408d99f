package com.tracewire.proxy.core.services;

import com.tracewire.proxy.config.TracewireProperties;
import com.tracewire.proxy.core.proxy.ProxyDefinition;
import com.tracewire.proxy.core.trace.Trace;
import com.tracewire.proxy.core.trace.TraceRenderer;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders stopped traces into the configured trace output directory.
 */
public class TraceOutputService {

    private static final Logger log = LoggerFactory.getLogger(TraceOutputService.class);
    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS")
            .withZone(ZoneOffset.UTC);

    private volatile Path outputDirectory;

    public TraceOutputService(TracewireProperties properties) {
        updateProperties(properties);
    }

    public void updateProperties(TracewireProperties properties) {
        String path = properties.getTraceOutputPath();
        this.outputDirectory = Paths.get(path == null || path.isBlank() ? "traces" : path);
    }

    /**
     * Renders a stopped trace in the proxy's output format. When the proxy has
     * {@code renderAfterTrace} enabled the result is written to
     * {@code trace-<port>-<timestamp>.<ext>}; otherwise only the entry count is
     * logged.
     * 
     * @param definition The proxy the trace belongs to.
     * @param trace      The stopped trace.
     * @return The written file, or {@code null} if nothing was written.
     */
    public Path publish(ProxyDefinition definition, Trace trace) {
        if (!definition.isRenderAfterTrace()) {
            log.info("Trace of '{}' finished with {} entries", definition.getName(), trace.size());
            return null;
        }

        TraceRenderer renderer = new TraceRenderer(definition.getName(), definition.getHexWidth());
        String rendered = renderer.render(trace.getEntries(), definition.getOutputFormat());
        String fileName = "trace-" + definition.getPort() + "-"
                + FILE_TIME.format(trace.getStoppedAt() != null ? trace.getStoppedAt() : trace.getStartedAt())
                + "." + definition.getOutputFormat().getFileExtension();
        Path file = outputDirectory.resolve(fileName);
        try {
            Files.createDirectories(outputDirectory);
            Files.writeString(file, rendered, StandardCharsets.UTF_8);
            log.info("Trace of '{}' ({} entries) written to {}", definition.getName(), trace.size(), file);
            return file;
        } catch (IOException e) {
            log.error("Failed to write trace of '{}' to {}: {}", definition.getName(), file, e.getMessage());
            return null;
        }
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }
}
