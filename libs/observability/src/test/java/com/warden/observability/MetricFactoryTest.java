package com.warden.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link MetricFactory}: construction guards and tagged meter registration. */
@DisplayName("MetricFactory")
class MetricFactoryTest {

    private SimpleMeterRegistry registry;
    private MetricFactory factory;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        factory = new MetricFactory(registry, "attestor");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new MetricFactory(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new MetricFactory(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }
    }

    @Nested
    @DisplayName("Meters")
    class Meters {

        @Test
        @DisplayName("counter carries service and extra tags")
        void counterCarriesTags() {
            Counter counter = factory.counter("attestor.attest.requests", "requests",
                    "strategy", "local", "outcome", "success");
            counter.increment();

            Counter found = registry.get("attestor.attest.requests")
                    .tag(MetricFactory.TAG_SERVICE, "attestor")
                    .tag("strategy", "local")
                    .tag("outcome", "success")
                    .counter();
            assertThat(found.count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("same name and tags return the same counter")
        void sameCounterReturned() {
            factory.counter("c", "d", "k", "v").increment();
            factory.counter("c", "d", "k", "v").increment();

            assertThat(registry.get("c").counter().count()).isEqualTo(2.0);
        }

        @Test
        @DisplayName("timer records durations")
        void timerRecords() {
            Timer timer = factory.timer("attestor.attest.duration", "latency", "strategy", "external");
            timer.record(Duration.ofMillis(15));

            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.getId().getTag(MetricFactory.TAG_SERVICE)).isEqualTo("attestor");
        }
    }
}
