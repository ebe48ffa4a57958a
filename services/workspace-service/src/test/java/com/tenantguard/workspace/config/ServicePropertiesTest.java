package com.tenantguard.workspace.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tenantguard.quota.config.RateLimitConfig;
import com.tenantguard.security.Role;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Service configuration properties")
class ServicePropertiesTest {

    @Nested
    @DisplayName("WorkspaceServiceProperties")
    class Service {

        @Test
        @DisplayName("defaults environment to 'development' when null")
        void defaultsEnvironment() {
            var props = new WorkspaceServiceProperties("workspace-service", null, null, true);
            assertThat(props.environment()).isEqualTo("development");
        }
    }

    @Nested
    @DisplayName("QuotaProperties")
    class Quota {

        @Test
        @DisplayName("applies defaults for missing values")
        void defaults() {
            var props = new QuotaProperties(null, false, null, Duration.ZERO);

            assertThat(props.operations()).isEmpty();
            assertThat(props.retention()).isEqualTo(Duration.ofDays(30));
            assertThat(props.sweepInterval()).isEqualTo(Duration.ofMinutes(10));
        }

        @Test
        @DisplayName("keeps configured overrides")
        void overrides() {
            var props = new QuotaProperties(Map.of("mutation.create", new RateLimitConfig(40, 20, 2)),
                    true, Duration.ofDays(7), Duration.ofMinutes(1));

            assertThat(props.operations()).containsKey("mutation.create");
            assertThat(props.auditAsync()).isTrue();
            assertThat(props.retention()).isEqualTo(Duration.ofDays(7));
        }
    }

    @Nested
    @DisplayName("AccountSeedProperties")
    class Accounts {

        @Test
        @DisplayName("converts seed entries, active by default")
        void convert() {
            var props = new AccountSeedProperties(List.of(
                    new AccountSeedProperties.SeedAccount("u1", "t1", "sub-u1", "Manager", null),
                    new AccountSeedProperties.SeedAccount("u2", "t1", "sub-u2", "viewer", false)));

            assertThat(props.toAccounts()).satisfiesExactly(
                    first -> {
                        assertThat(first.role()).isEqualTo(Role.MANAGER);
                        assertThat(first.active()).isTrue();
                    },
                    second -> assertThat(second.active()).isFalse());
        }

        @Test
        @DisplayName("rejects an unknown role")
        void unknownRole() {
            var seed = new AccountSeedProperties.SeedAccount("u1", "t1", "sub-u1", "superuser", true);

            assertThatThrownBy(seed::toAccount)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("superuser");
        }

        @Test
        @DisplayName("no accounts configured yields an empty list")
        void empty() {
            assertThat(new AccountSeedProperties(null).toAccounts()).isEmpty();
        }
    }
}
