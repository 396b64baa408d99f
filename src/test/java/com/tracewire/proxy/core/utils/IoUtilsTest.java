package com.tracewire.proxy.core.utils;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IoUtilsTest {

    @Test
    void readChunk_returnsCopyOfBytesRead() throws IOException {
        byte[] buffer = new byte[8];
        InputStream in = new ByteArrayInputStream("abc".getBytes());

        byte[] chunk = IoUtils.readChunk(in, buffer);

        assertThat(chunk).isEqualTo("abc".getBytes());
        buffer[0] = 'z';
        assertThat(chunk[0]).isEqualTo((byte) 'a');
        assertThat(IoUtils.readChunk(in, buffer)).isNull();
    }

    @Test
    void readChunk_timeout_propagates() {
        InputStream idle = new InputStream() {
            @Override
            public int read() throws IOException {
                throw new SocketTimeoutException("Read timed out");
            }

            @Override
            public int read(byte[] b, int off, int len) throws IOException {
                throw new SocketTimeoutException("Read timed out");
            }
        };

        assertThatThrownBy(() -> IoUtils.readChunk(idle, new byte[4])).isInstanceOf(SocketTimeoutException.class);
    }

    @Test
    void closeQuietly_swallowsFailures() {
        assertThatCode(() -> IoUtils.closeQuietly(() -> {
            throw new IOException("boom");
        }, "failing")).doesNotThrowAnyException();
        assertThatCode(() -> IoUtils.closeQuietly(null, "nothing")).doesNotThrowAnyException();
        assertThatCode(() -> IoUtils.shutdownOutputQuietly(null, "nothing")).doesNotThrowAnyException();
    }

    @Test
    void describe_includesTypeAndMessage() {
        assertThat(IoUtils.describe(new IOException("Broken pipe"))).isEqualTo("IOException: Broken pipe");
        assertThat(IoUtils.describe(new SocketTimeoutException())).isEqualTo("SocketTimeoutException");
    }
}
