package com.tenantguard.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear")
    class Lifecycle {

        @Test
        @DisplayName("is empty when nothing was set")
        void emptyByDefault() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("returns the context that was set")
        void storesContext() {
            var ctx = CorrelationContext.forRequest("corr-1", "req-1", "10.0.0.1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).contains(ctx);
        }

        @Test
        @DisplayName("rejects null")
        void rejectsNull() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("clear removes context and MDC keys")
        void clearRemovesEverything() {
            CorrelationContextHolder.set(new CorrelationContext("c", "r", "o", "t", "u"));
            CorrelationContextHolder.clear();

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("tenantId")).isNull();
            assertThat(MDC.get("userId")).isNull();
            assertThat(MDC.get("origin")).isNull();
        }
    }

    @Nested
    @DisplayName("bindPrincipal()")
    class BindPrincipal {

        @Test
        @DisplayName("adds tenant and user to the open context and the MDC")
        void bindsOntoOpenContext() {
            CorrelationContextHolder.set(CorrelationContext.forRequest("corr-9", "req-9", null));

            CorrelationContextHolder.bindPrincipal("tenant-a", "user-1");

            var ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.correlationId()).isEqualTo("corr-9");
            assertThat(ctx.tenantId()).isEqualTo("tenant-a");
            assertThat(ctx.hasPrincipal()).isTrue();
            assertThat(MDC.get("tenantId")).isEqualTo("tenant-a");
            assertThat(MDC.get("userId")).isEqualTo("user-1");
        }

        @Test
        @DisplayName("does nothing when no context is open")
        void noOpWithoutContext() {
            CorrelationContextHolder.bindPrincipal("tenant-a", "user-1");

            assertThat(CorrelationContextHolder.get()).isEmpty();
            assertThat(MDC.get("tenantId")).isNull();
        }
    }

    @Nested
    @DisplayName("callWithContext()")
    class CallWithContext {

        @Test
        @DisplayName("exposes the context during the call and restores the previous one")
        void restoresPrevious() {
            var outer = CorrelationContext.forRequest("outer", null, null);
            var inner = CorrelationContext.forRequest("inner", null, null);
            CorrelationContextHolder.set(outer);
            var seen = new AtomicReference<String>();

            String result = CorrelationContextHolder.callWithContext(inner, () -> {
                seen.set(MDC.get("correlationId"));
                return "done";
            });

            assertThat(result).isEqualTo("done");
            assertThat(seen.get()).isEqualTo("inner");
            assertThat(CorrelationContextHolder.get()).contains(outer);
        }

        @Test
        @DisplayName("clears afterwards when nothing was set before")
        void clearsWhenNoPrevious() {
            CorrelationContextHolder.callWithContext(CorrelationContext.forRequest("x", null, null), () -> null);

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Test
    @DisplayName("context rejects a blank correlation id")
    void rejectsBlankCorrelationId() {
        assertThatThrownBy(() -> CorrelationContext.forRequest(" ", null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("correlationId");
    }
}
