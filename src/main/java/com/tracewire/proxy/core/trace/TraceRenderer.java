package com.tracewire.proxy.core.trace;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.tracewire.proxy.core.constants.OutputFormat;
import com.tracewire.proxy.core.constants.ProxyDirection;
import com.tracewire.proxy.core.exceptions.ProxyException;
import com.tracewire.proxy.core.utils.JsonSupport;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders finished traces as text.
 */
public class TraceRenderer {

    public static final int DEFAULT_HEX_WIDTH = 16;

    private static final String EOL = "\n";
    private static final TypeReference<List<TraceEntry>> ENTRY_LIST = new TypeReference<>() {
    };

    private final String proxyName;
    private final int hexWidth;

    /**
     * @param proxyName Name shown in the text format.
     * @param hexWidth  Bytes per hex dump row.
     */
    public TraceRenderer(String proxyName, int hexWidth) {
        this.proxyName = proxyName;
        this.hexWidth = hexWidth > 0 ? hexWidth : DEFAULT_HEX_WIDTH;
    }

    /**
     * @param entries Entries to render.
     * @param format  Output format.
     * @return The rendered trace.
     */
    public String render(List<TraceEntry> entries, OutputFormat format) {
        return switch (format) {
            case ASCII -> renderAscii(entries);
            case HTTP -> renderHttp(entries);
            case JSON -> JsonSupport.toPrettyJson(entries);
            case TEXT -> entries.stream().map(this::renderEntry).collect(Collectors.joining(EOL));
        };
    }

    /**
     * Renders one entry as a descriptive line followed by a hex dump of its
     * chunk.
     * 
     * @param entry The entry.
     * @return The rendered entry, ending with a line feed.
     */
    public String renderEntry(TraceEntry entry) {
        StringBuilder sb = new StringBuilder();
        sb.append("[TRACE] '").append(proxyName).append("': ").append(describe(entry)).append(EOL);
        byte[] chunk = entry.chunk();
        if (chunk != null) {
            sb.append(HexDump.format(chunk, hexWidth));
        }
        return sb.toString();
    }

    /**
     * Describes the endpoints of an entry with the client side on the left,
     * e.g. {@code [0] '10.0.0.1:5000' => [1] '10.0.0.2:80'}.
     * 
     * @param entry The entry.
     * @return The description.
     */
    public static String describe(TraceEntry entry) {
        String source = "[" + entry.sourceIndex() + "] '" + entry.source() + "'";
        String target = "[" + entry.targetIndex() + "] '" + entry.target() + "'";
        if (entry.direction() == ProxyDirection.CLIENT_TO_TARGET) {
            return source + " " + entry.direction().getArrow() + " " + target;
        }
        return target + " " + entry.direction().getArrow() + " " + source;
    }

    private static String renderAscii(List<TraceEntry> entries) {
        return entries.stream()
                .map(e -> {
                    byte[] chunk = e.chunk();
                    return chunk != null ? new String(chunk, StandardCharsets.US_ASCII) : "";
                })
                .collect(Collectors.joining(EOL + EOL));
    }

    private static String renderHttp(List<TraceEntry> entries) {
        Map<String, ByteArrayOutputStream> groups = new LinkedHashMap<>();
        for (TraceEntry entry : entries) {
            ByteArrayOutputStream group = groups.computeIfAbsent(entry.groupKey(), k -> new ByteArrayOutputStream());
            byte[] chunk = entry.chunk();
            if (chunk != null) {
                group.writeBytes(chunk);
            }
        }
        ByteArrayOutputStream all = new ByteArrayOutputStream();
        groups.values().forEach(group -> all.writeBytes(group.toByteArray()));
        return all.toString(StandardCharsets.US_ASCII);
    }

    /**
     * Parses a trace rendered with {@link OutputFormat#JSON}.
     * 
     * @param json The JSON dump.
     * @return The entries.
     * @throws ProxyException if the input is not a valid dump.
     */
    public static List<TraceEntry> parseJson(String json) {
        try {
            return JsonSupport.mapper().readValue(json, ENTRY_LIST);
        } catch (JsonProcessingException e) {
            throw new ProxyException("Invalid trace JSON: " + e.getOriginalMessage(), e);
        }
    }
}
