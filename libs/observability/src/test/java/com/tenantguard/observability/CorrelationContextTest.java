package com.tenantguard.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CorrelationContext")
class CorrelationContextTest {

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("an edge context carries no principal")
        void forRequest() {
            var ctx = CorrelationContext.forRequest("corr-001", "req-001", "203.0.113.7");

            assertThat(ctx.correlationId()).isEqualTo("corr-001");
            assertThat(ctx.requestId()).isEqualTo("req-001");
            assertThat(ctx.networkOrigin()).isEqualTo("203.0.113.7");
            assertThat(ctx.hasPrincipal()).isFalse();
        }

        @Test
        @DisplayName("should reject a null or blank correlationId")
        void rejectsBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.forRequest(null, "r", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
            assertThatThrownBy(() -> CorrelationContext.forRequest("  ", "r", null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Test
    @DisplayName("withPrincipal returns a bound copy and leaves the original untouched")
    void withPrincipal() {
        var edge = CorrelationContext.forRequest("corr-001", "req-001", null);

        var bound = edge.withPrincipal("tenant-001", "user-001");

        assertThat(bound.hasPrincipal()).isTrue();
        assertThat(bound.tenantId()).isEqualTo("tenant-001");
        assertThat(bound.userId()).isEqualTo("user-001");
        assertThat(bound.correlationId()).isEqualTo("corr-001");
        assertThat(edge.hasPrincipal()).isFalse();
    }
}
