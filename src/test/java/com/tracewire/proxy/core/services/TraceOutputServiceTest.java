package com.tracewire.proxy.core.services;

import com.tracewire.proxy.config.TracewireProperties;
import com.tracewire.proxy.core.constants.OutputFormat;
import com.tracewire.proxy.core.proxy.ProxyDefinition;
import com.tracewire.proxy.core.proxy.TargetAddress;
import com.tracewire.proxy.core.trace.Trace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class TraceOutputServiceTest {

    @TempDir
    Path dir;

    private TraceOutputService service(Path output) {
        TracewireProperties props = new TracewireProperties();
        props.setTraceOutputPath(output.toString());
        return new TraceOutputService(props);
    }

    private static ProxyDefinition.Builder definition() {
        return ProxyDefinition.builder(9000).name("api").target(new TargetAddress("127.0.0.1", 9100));
    }

    @Test
    void publish_writesFileNamedAfterPortWithFormatExtension() throws Exception {
        Path file = service(dir.resolve("traces")).publish(definition().outputFormat(OutputFormat.JSON).build(),
                new Trace());

        assertThat(file).isNotNull();
        assertThat(file.getParent()).isEqualTo(dir.resolve("traces"));
        assertThat(file.getFileName().toString()).matches("trace-9000-\\d{8}-\\d{6}-\\d{3}\\.json");
        assertThat(Files.readString(file).trim()).isEqualTo("[ ]");
    }

    @Test
    void publish_renderingDisabled_writesNothing() {
        Path file = service(dir).publish(definition().renderAfterTrace(false).build(), new Trace());

        assertThat(file).isNull();
        assertThat(dir).isEmptyDirectory();
    }

    @Test
    void publish_unwritableDirectory_returnsNull() throws Exception {
        Path blocker = Files.writeString(dir.resolve("blocker"), "x");

        assertThat(service(blocker).publish(definition().build(), new Trace())).isNull();
    }

    @Test
    void updateProperties_blankPath_usesDefault() {
        TraceOutputService service = service(dir);
        TracewireProperties props = new TracewireProperties();
        props.setTraceOutputPath(" ");

        service.updateProperties(props);

        assertThat(service.getOutputDirectory()).isEqualTo(Path.of("traces"));
    }
}
