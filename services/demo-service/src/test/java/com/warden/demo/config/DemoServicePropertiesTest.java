package com.warden.demo.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DemoServiceProperties")
class DemoServicePropertiesTest {

    @Test
    @DisplayName("accepts valid properties")
    void acceptsValidProperties() {
        var props = new DemoServiceProperties("demo", "production", 8, false);
        assertThat(props.name()).isEqualTo("demo");
        assertThat(props.environment()).isEqualTo("production");
        assertThat(props.probeThreads()).isEqualTo(8);
        assertThat(props.emitTenantClaim()).isFalse();
    }

    @Test
    @DisplayName("defaults environment to 'development' when null")
    void defaultsEnvironmentWhenNull() {
        assertThat(new DemoServiceProperties("demo", null, 8, null).environment()).isEqualTo("development");
    }

    @Test
    @DisplayName("defaults probeThreads to 4 when zero or negative")
    void defaultsProbeThreads() {
        assertThat(new DemoServiceProperties("demo", "dev", 0, null).probeThreads()).isEqualTo(4);
        assertThat(new DemoServiceProperties("demo", "dev", -1, null).probeThreads()).isEqualTo(4);
    }

    @Test
    @DisplayName("defaults emitTenantClaim to true when unset")
    void defaultsEmitTenantClaim() {
        assertThat(new DemoServiceProperties("demo", "dev", 4, null).emitTenantClaim()).isTrue();
    }
}
