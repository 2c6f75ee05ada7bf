package com.medexus.backend.modules.interest.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ExpressInterestRequest(@NotNull(message = "must be provided") UUID requestId) {
}
