package com.tracewire.proxy.core.hooks;

import com.tracewire.proxy.core.constants.OutputFormat;
import com.tracewire.proxy.core.trace.TraceEntry;
import com.tracewire.proxy.core.trace.TraceRenderer;
import com.tracewire.proxy.core.utils.ValueUtils;
import com.tracewire.proxy.spi.TraceWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes every stopped trace to a new file.
 * <p>
 * Options: {@code directory} (default {@code traces}), {@code format}
 * (default {@code json}), {@code name} (shown in the text format) and
 * {@code hexWidth}. The path of the last written file is stored in the hook
 * state.
 * </p>
 */
public class FileTraceWriter implements TraceWriter {

    private static final Logger log = LoggerFactory.getLogger(FileTraceWriter.class);
    private static final DateTimeFormatter FILE_TIME = DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss-SSS");
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    @Override
    public CompletionStage<Void> writeTrace(List<TraceEntry> trace, HookContext context) {
        Map<String, Object> options = context.options();
        Path directory = Paths.get(ValueUtils.optionString(options, "directory", "traces"));
        OutputFormat format = OutputFormat.parse(ValueUtils.optionString(options, "format", null), OutputFormat.JSON);
        Integer hexWidth = ValueUtils.toInteger(options.get("hexWidth"));
        TraceRenderer renderer = new TraceRenderer(ValueUtils.optionString(options, "name", "trace"),
                hexWidth != null ? hexWidth : TraceRenderer.DEFAULT_HEX_WIDTH);

        return CompletableFuture.runAsync(() -> {
            try {
                Files.createDirectories(directory);
                String fileName = "trace-" + FILE_TIME.format(ZonedDateTime.now(ZoneOffset.UTC)) + "-"
                        + SEQUENCE.incrementAndGet() + "." + format.getFileExtension();
                Path file = directory.resolve(fileName);
                Files.writeString(file, renderer.render(trace, format), StandardCharsets.UTF_8);
                context.state().set(file.toString());
                log.info("Wrote {} trace entries to {}", trace.size(), file);
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot write trace to " + directory, e);
            }
        });
    }
}
