package com.kpisentinel.service.lifecycle;

import java.util.Locale;

/**
 * Caller role, ordered by privilege: {@code reader < operator < admin}.
 */
public enum Role {

    READER(0),
    OPERATOR(1),
    ADMIN(2);

    private final int rank;

    Role(int rank) {
        this.rank = rank;
    }

    /**
     * Parse a role name. A missing name means {@link #READER}.
     *
     * @param value role name, case-insensitive, may be {@code null}
     * @return the role
     * @throws InsufficientRoleException if the name is not a known role
     */
    public static Role parse(String value) {
        if (value == null || value.isBlank()) {
            return READER;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "reader" -> READER;
            case "operator" -> OPERATOR;
            case "admin" -> ADMIN;
            default -> throw new InsufficientRoleException("Invalid role");
        };
    }

    public boolean atLeast(Role required) {
        return rank >= required.rank;
    }

    /**
     * @throws InsufficientRoleException if this role ranks below {@code required}
     */
    public void require(Role required) {
        if (!atLeast(required)) {
            throw new InsufficientRoleException("Insufficient role");
        }
    }
}
