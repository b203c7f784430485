package com.warden.attestorservice.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AttestorConfiguration")
class AttestorConfigurationTest {

    @Test
    @DisplayName("auth timeout converts to whole milliseconds")
    void timeoutMillis() {
        assertThat(AttestorConfiguration.timeoutMillis(Duration.ofSeconds(2))).isEqualTo(2000);
        assertThat(AttestorConfiguration.timeoutMillis(Duration.ofMillis(1500))).isEqualTo(1500);
    }

    @Test
    @DisplayName("auth timeout beyond the int range is rejected instead of wrapping")
    void timeoutOverflow() {
        assertThatThrownBy(() -> AttestorConfiguration.timeoutMillis(Duration.ofDays(30)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("auth-timeout")
                .hasCauseInstanceOf(ArithmeticException.class);
    }
}
