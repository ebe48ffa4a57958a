package com.tenantguard.guard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantguard.security.RejectionReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("GuardedOperation")
class GuardedOperationTest {

    @Test
    @DisplayName("is charged against its own name by default")
    void defaultsRateLimitOperation() {
        var op = GuardedOperation.of("query.list.vendors", "vendors.read");
        assertThat(op.rateLimitOperation()).isEqualTo("query.list.vendors");
        assertThat(op.costOverride()).isNull();
    }

    @Test
    @DisplayName("chargedAs() and withCost() keep the other fields")
    void derived() {
        var op = GuardedOperation.of("action.export.contracts", "contracts.read")
                .chargedAs("action.export")
                .withCost(2);
        assertThat(op.name()).isEqualTo("action.export.contracts");
        assertThat(op.rateLimitOperation()).isEqualTo("action.export");
        assertThat(op.permission()).isEqualTo("contracts.read");
        assertThat(op.costOverride()).isEqualTo(2);
    }

    @Test
    @DisplayName("rejects a non-positive cost")
    void invalidCost() {
        assertThatThrownBy(() -> GuardedOperation.of("x", null).withCost(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest
    @EnumSource(RejectionReason.class)
    @DisplayName("every rejection reason has an outcome of the same name")
    void outcomeMapping(RejectionReason reason) {
        assertThat(OperationOutcome.of(reason).name()).isEqualTo(reason.name());
    }
}
