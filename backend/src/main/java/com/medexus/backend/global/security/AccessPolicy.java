package com.medexus.backend.global.security;

import java.util.Objects;
import java.util.UUID;

import com.medexus.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Role and ownership checks applied before any mutation.
 */
@Component
public class AccessPolicy {

    /**
     * Fails with 401 when no actor is present and 403 when the actor's role does not
     * grant the capability.
     */
    public JwtAuthenticationPrincipal require(JwtAuthenticationPrincipal actor, Capability capability) {
        if (actor == null || actor.userId() == null || actor.role() == null) {
            throw new ProblemException(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required");
        }
        if (!actor.hasRole(capability.getRequiredRole())) {
            throw ProblemException.forbidden(
                    capability.getRequiredRole().name() + "_ROLE_REQUIRED",
                    capability.getDeniedMessage()
            );
        }
        return actor;
    }

    public void requireOwner(JwtAuthenticationPrincipal actor, UUID ownerId, Capability capability) {
        require(actor, capability);
        if (!isOwner(actor, ownerId)) {
            throw ProblemException.forbidden("REQUEST_OWNERSHIP_REQUIRED", "Can only modify your own requests");
        }
    }

    public boolean isOwner(JwtAuthenticationPrincipal actor, UUID ownerId) {
        return actor != null && ownerId != null && Objects.equals(actor.userId(), ownerId);
    }
}
