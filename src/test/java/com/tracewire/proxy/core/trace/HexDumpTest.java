package com.tracewire.proxy.core.trace;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HexDumpTest {

    @Test
    void format_shortChunk_padsHexColumn() {
        String dump = HexDump.format("PING".getBytes(StandardCharsets.US_ASCII), 16);

        assertThat(dump).startsWith("00000000: 5049 4e47 ").endsWith("  PING\n");
        // offset + 8 groups of 4 hex digits + ascii
        assertThat(dump.indexOf("PING")).isEqualTo(10 + 8 * 5 + 1);
    }

    @Test
    void format_multipleRows_advancesOffset() {
        byte[] data = new byte[20];
        for (int i = 0; i < data.length; i++) {
            data[i] = (byte) ('a' + i);
        }

        String[] rows = HexDump.format(data, 16).split("\n");

        assertThat(rows).hasSize(2);
        assertThat(rows[0]).startsWith("00000000: 6162 6364").endsWith("abcdefghijklmnop");
        assertThat(rows[1]).startsWith("00000010: 7172 7374").endsWith("qrst");
    }

    @Test
    void format_nonPrintable_showsDots() {
        String dump = HexDump.format(new byte[] { 0x00, 0x7f, (byte) 0xff, 'A' }, 4);

        assertThat(dump).isEqualTo("00000000: 007f ff41  ...A\n");
    }

    @Test
    void format_oddWidth_keepsColumnsAligned() {
        String first = HexDump.format(new byte[] { 1, 2, 3, 4, 5, 6 }, 3).split("\n")[0];

        assertThat(first).isEqualTo("00000000: 0102 03  ...");
    }

    @Test
    void format_empty_isEmpty() {
        assertThat(HexDump.format(new byte[0], 16)).isEmpty();
    }

    @Test
    void format_invalidWidth_throws() {
        assertThatThrownBy(() -> HexDump.format(new byte[1], 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
