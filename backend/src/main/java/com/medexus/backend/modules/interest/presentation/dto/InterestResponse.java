package com.medexus.backend.modules.interest.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medexus.backend.modules.interest.domain.Interest;

public record InterestResponse(UUID id, UUID requestId, UUID doctorId, OffsetDateTime timestamp) {

    public static InterestResponse from(Interest interest) {
        return new InterestResponse(
                interest.getId(),
                interest.getRequestId(),
                interest.getDoctorId(),
                interest.getExpressedAt()
        );
    }
}
