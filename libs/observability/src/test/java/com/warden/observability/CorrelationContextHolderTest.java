package com.warden.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge and scoped
 * execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "Attest", "42");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("should clear context")
        void shouldClearContext() {
            CorrelationContextHolder.set(new CorrelationContext("corr-1", "Attest", null));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys and skip null values")
        void shouldPopulateMdc() {
            CorrelationContextHolder.set(new CorrelationContext("corr-9", "Configure", null));

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("corr-9");
            assertThat(MDC.get(CorrelationContext.MDC_OPERATION)).isEqualTo("Configure");
            assertThat(MDC.get(CorrelationContext.MDC_PID)).isNull();
        }

        @Test
        @DisplayName("should remove MDC keys on clear")
        void shouldRemoveMdcOnClear() {
            CorrelationContextHolder.set(new CorrelationContext("corr-9", "Attest", "7"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isNull();
            assertThat(MDC.get(CorrelationContext.MDC_PID)).isNull();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should expose context inside the runnable and clear it afterwards")
        void shouldScopeContext() {
            var seen = new AtomicReference<CorrelationContext>();
            var ctx = new CorrelationContext("corr-2", "Attest", "100");

            CorrelationContextHolder.runWithContext(ctx, () -> seen.set(CorrelationContextHolder.get().orElse(null)));

            assertThat(seen.get()).isEqualTo(ctx);
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should restore the previous context")
        void shouldRestorePrevious() {
            var outer = new CorrelationContext("outer", "Attest", null);
            CorrelationContextHolder.set(outer);

            CorrelationContextHolder.runWithContext(new CorrelationContext("inner", "Attest", "1"), () -> { });

            assertThat(CorrelationContextHolder.get()).contains(outer);
            assertThat(MDC.get(CorrelationContext.MDC_CORRELATION_ID)).isEqualTo("outer");
        }
    }
}
