package com.tracewire.proxy.core.trace;

/**
 * Classic offset / hex / ASCII dump of a byte array, bytes grouped in pairs:
 * <pre>
 * 00000000: 5049 4e47                                PING
 * </pre>
 */
public final class HexDump {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private HexDump() {
        // Utility class
    }

    /**
     * @param data  Bytes to dump.
     * @param width Bytes per row.
     * @return The dump, one row per line, each ending with a line feed.
     */
    public static String format(byte[] data, int width) {
        if (width <= 0) {
            throw new IllegalArgumentException("width must be positive: " + width);
        }
        StringBuilder sb = new StringBuilder();
        for (int offset = 0; offset < data.length; offset += width) {
            appendOffset(sb, offset);
            int rowEnd = Math.min(offset + width, data.length);
            for (int i = 0; i < width; i++) {
                int pos = offset + i;
                if (pos < rowEnd) {
                    int b = data[pos] & 0xff;
                    sb.append(HEX[b >>> 4]).append(HEX[b & 0x0f]);
                } else {
                    sb.append("  ");
                }
                if (i % 2 == 1) {
                    sb.append(' ');
                }
            }
            if (width % 2 == 1) {
                sb.append(' ');
            }
            sb.append(' ');
            for (int pos = offset; pos < rowEnd; pos++) {
                int b = data[pos] & 0xff;
                sb.append(b >= 0x20 && b < 0x7f ? (char) b : '.');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void appendOffset(StringBuilder sb, int offset) {
        for (int shift = 28; shift >= 0; shift -= 4) {
            sb.append(HEX[(offset >>> shift) & 0x0f]);
        }
        sb.append(": ");
    }
}
