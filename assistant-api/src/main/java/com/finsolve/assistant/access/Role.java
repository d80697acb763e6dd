package com.finsolve.assistant.access;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Department roles recognized by the assistant. A role is the only input to
 * collection scoping; no other part of the pipeline branches on role names.
 */
public enum Role {
    FINANCE("Finance"),
    MARKETING("Marketing"),
    HR("HR"),
    ENGINEERING("Engineering"),
    EMPLOYEE("Employee"),
    C_LEVEL("C-Level");

    private final String tag;

    Role(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    /**
     * Parses a role from its display tag ({@code C-Level}), its constant name
     * ({@code C_LEVEL}) or an authority ({@code ROLE_C_LEVEL}), ignoring case.
     */
    public static Optional<Role> fromTag(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if (normalized.startsWith("ROLE_")) {
            normalized = normalized.substring("ROLE_".length());
        }
        String candidate = normalized.replace('-', '_').replace(' ', '_');
        return Arrays.stream(values())
                .filter(role -> role.name().equals(candidate))
                .findFirst();
    }
}
