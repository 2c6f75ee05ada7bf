package com.medexus.backend.modules.request.presentation.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of create and full-replace update. Only presence is checked; urgency and date stay free-form.
 */
public record SurgeryRequestPayload(
        @NotNull(message = "must be provided") @Size(max = 200) String surgeryType,
        @NotNull(message = "must be provided") @Size(max = 120) String requiredSpecialization,
        @NotNull(message = "must be provided") @Size(max = 32) String urgency,
        @NotNull(message = "must be provided") @Size(max = 64) String date,
        @NotNull(message = "must be provided") @Size(max = 200) String location,
        @Size(max = 200) String hospitalName,
        @Size(max = 4000) String conditionDescription
) {
}
