package com.kpisentinel.service.lifecycle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Role}.
 */
class RoleTest {

    @Test
    @DisplayName("Should parse role names case-insensitively and default to reader")
    void shouldParse() {
        assertThat(Role.parse("Operator")).isEqualTo(Role.OPERATOR);
        assertThat(Role.parse("ADMIN")).isEqualTo(Role.ADMIN);
        assertThat(Role.parse(null)).isEqualTo(Role.READER);
        assertThat(Role.parse(" ")).isEqualTo(Role.READER);
    }

    @Test
    @DisplayName("Should reject an unknown role")
    void shouldRejectUnknownRole() {
        assertThatThrownBy(() -> Role.parse("superuser"))
                .isInstanceOf(InsufficientRoleException.class)
                .hasMessage("Invalid role");
    }

    @Test
    @DisplayName("Roles should be ordered reader < operator < admin")
    void shouldOrderRoles() {
        assertThat(Role.ADMIN.atLeast(Role.OPERATOR)).isTrue();
        assertThat(Role.OPERATOR.atLeast(Role.OPERATOR)).isTrue();
        assertThat(Role.READER.atLeast(Role.OPERATOR)).isFalse();
    }
}
