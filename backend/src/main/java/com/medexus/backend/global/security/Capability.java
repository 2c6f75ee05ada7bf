package com.medexus.backend.global.security;

import com.medexus.backend.modules.auth.domain.Role;

/**
 * Role-gated operations. Every mutating endpoint names one of these and asks
 * {@link AccessPolicy} before touching storage.
 */
public enum Capability {
    CREATE_REQUEST(Role.HOSPITAL, "Only hospitals can create requests"),
    UPDATE_REQUEST(Role.HOSPITAL, "Only hospitals can update requests"),
    DELETE_REQUEST(Role.HOSPITAL, "Only hospitals can delete requests"),
    EXPRESS_INTEREST(Role.DOCTOR, "Only doctors can express interest"),
    WITHDRAW_INTEREST(Role.DOCTOR, "Only doctors can withdraw interest"),
    VIEW_OWN_INTERESTS(Role.DOCTOR, "Only doctors have interests");

    private final Role requiredRole;
    private final String deniedMessage;

    Capability(Role requiredRole, String deniedMessage) {
        this.requiredRole = requiredRole;
        this.deniedMessage = deniedMessage;
    }

    public Role getRequiredRole() {
        return requiredRole;
    }

    public String getDeniedMessage() {
        return deniedMessage;
    }
}
