package com.tracewire.proxy.core.proxy;

import com.tracewire.proxy.core.exceptions.ConfigException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetAddressTest {

    @Test
    void parse_bareInteger_usesLoopback() {
        assertThat(TargetAddress.parse(9100)).isEqualTo(new TargetAddress("127.0.0.1", 9100));
        assertThat(TargetAddress.parse("9100")).isEqualTo(new TargetAddress("127.0.0.1", 9100));
    }

    @Test
    void parse_hostAndPort() {
        assertThat(TargetAddress.parse("example.org:443")).isEqualTo(new TargetAddress("example.org", 443));
        assertThat(TargetAddress.parse(" 10.0.0.2:80 ")).isEqualTo(new TargetAddress("10.0.0.2", 80));
    }

    @Test
    void parse_bareHost_usesDefaultPort() {
        assertThat(TargetAddress.parse("backend")).isEqualTo(new TargetAddress("backend", TargetAddress.DEFAULT_PORT));
    }

    @Test
    void parse_bracketedIpv6() {
        TargetAddress address = TargetAddress.parse("[::1]:9000");
        assertThat(address.host()).isEqualTo("::1");
        assertThat(address.port()).isEqualTo(9000);
        assertThat(address).hasToString("[::1]:9000");
    }

    @Test
    void parse_malformed_throwsConfigException() {
        assertThatThrownBy(() -> TargetAddress.parse("host:abc")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TargetAddress.parse("host:70000")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TargetAddress.parse("[::1")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TargetAddress.parse(" ")).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TargetAddress.parse(1.5)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TargetAddress.parse(4294976296L)).isInstanceOf(ConfigException.class);
    }

    @Test
    void parseAll_acceptsSingleValueOrList() {
        assertThat(TargetAddress.parseAll(8001)).containsExactly(new TargetAddress("127.0.0.1", 8001));
        assertThat(TargetAddress.parseAll(List.of(8001, "db:5432")))
                .containsExactly(new TargetAddress("127.0.0.1", 8001), new TargetAddress("db", 5432));
    }

    @Test
    void parseAll_withoutTargets_throwsConfigException() {
        assertThatThrownBy(() -> TargetAddress.parseAll(null)).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TargetAddress.parseAll(List.of())).isInstanceOf(ConfigException.class);
        assertThatThrownBy(() -> TargetAddress.parseAll(Arrays.asList((Object) null)))
                .isInstanceOf(ConfigException.class);
    }
}
