package com.medexus.backend.modules.request.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medexus.backend.modules.request.domain.SurgeryRequest;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Read view of a surgery request. {@code interestedDoctors} is only present on the owning hospital's view.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SurgeryRequestResponse(
        UUID id,
        UUID hospitalId,
        String surgeryType,
        String requiredSpecialization,
        String urgency,
        String date,
        String location,
        String hospitalName,
        String conditionDescription,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt,
        List<InterestedDoctorResponse> interestedDoctors
) {

    public static SurgeryRequestResponse from(SurgeryRequest request) {
        return new SurgeryRequestResponse(
                request.getId(),
                request.getHospitalId(),
                request.getSurgeryType(),
                request.getRequiredSpecialization(),
                request.getUrgency(),
                request.getDate(),
                request.getLocation(),
                request.getHospitalName(),
                request.getConditionDescription(),
                request.getCreatedAt(),
                request.getUpdatedAt(),
                null
        );
    }

    public SurgeryRequestResponse withHospitalName(String displayName) {
        return new SurgeryRequestResponse(id, hospitalId, surgeryType, requiredSpecialization, urgency, date,
                location, displayName, conditionDescription, createdAt, updatedAt, interestedDoctors);
    }

    public SurgeryRequestResponse withInterestedDoctors(List<InterestedDoctorResponse> doctors) {
        return new SurgeryRequestResponse(id, hospitalId, surgeryType, requiredSpecialization, urgency, date,
                location, hospitalName, conditionDescription, createdAt, updatedAt, List.copyOf(doctors));
    }
}
