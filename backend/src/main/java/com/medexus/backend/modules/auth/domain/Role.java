package com.medexus.backend.modules.auth.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Marketplace account role. Fixed at signup.
 */
public enum Role {
    HOSPITAL("hospital"),
    DOCTOR("doctor");

    private final String code;

    Role(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<Role> fromCode(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Role role : values()) {
            if (role.code.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
