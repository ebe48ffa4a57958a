package com.tenantguard.security;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Role")
class RoleTest {

    @Test
    @DisplayName("fromString() is case-insensitive")
    void caseInsensitive() {
        assertThat(Role.fromString("Admin")).contains(Role.ADMIN);
        assertThat(Role.fromString(" viewer ")).contains(Role.VIEWER);
    }

    @Test
    @DisplayName("fromString() returns empty for unknown or null names")
    void unknown() {
        assertThat(Role.fromString("superuser")).isEmpty();
        assertThat(Role.fromString(null)).isEmpty();
    }

    @Test
    @DisplayName("value() is the lowercase name")
    void value() {
        assertThat(Role.MANAGER.value()).isEqualTo("manager");
    }
}
