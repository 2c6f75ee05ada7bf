package com.medexus.backend.modules.auth.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.medexus.backend.modules.auth.domain.DoctorAccount;
import com.medexus.backend.modules.auth.domain.HospitalAccount;
import com.medexus.backend.modules.auth.domain.MarketUser;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record UserProfileResponse(
        UUID id,
        String name,
        String email,
        String role,
        String institutionName,
        String specialization,
        String bio,
        OffsetDateTime createdAt
) {

    public static UserProfileResponse from(MarketUser user) {
        String institutionName = null;
        String specialization = null;
        String bio = null;
        if (user instanceof HospitalAccount hospital) {
            institutionName = hospital.getInstitutionName();
        } else if (user instanceof DoctorAccount doctor) {
            specialization = doctor.getSpecialization();
            bio = doctor.getBio();
        }
        return new UserProfileResponse(
                user.getId(),
                user.getName(),
                user.getEmail(),
                user.getRole().getCode(),
                institutionName,
                specialization,
                bio,
                user.getCreatedAt()
        );
    }
}
