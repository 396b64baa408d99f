package com.tracewire.proxy.core.constants;

import java.util.Locale;

/**
 * Formats a finished trace can be rendered to.
 */
public enum OutputFormat {
    /**
     * Raw chunk bytes decoded as ASCII, one block per entry.
     */
    ASCII("txt"),

    /**
     * Chunk bytes concatenated per direction, endpoint pair and session.
     * Reads naturally for text protocols such as HTTP/1.x.
     */
    HTTP("http"),

    /**
     * Full structured dump of every entry.
     */
    JSON("json"),

    /**
     * One descriptive line plus a hex dump per entry. Default.
     */
    TEXT("log");

    private final String fileExtension;

    OutputFormat(String fileExtension) {
        this.fileExtension = fileExtension;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    /**
     * Resolves a format name case-insensitively. Blank or unknown names fall
     * back to {@code fallback}.
     *
     * @param value    Configured name, may be {@code null}.
     * @param fallback Format to use when {@code value} does not name one.
     * @return The resolved format.
     */
    public static OutputFormat parse(String value, OutputFormat fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
