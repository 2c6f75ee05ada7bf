package com.medexus.backend.modules.request.presentation.dto;

import java.util.UUID;

import com.medexus.backend.modules.auth.domain.DoctorAccount;

public record InterestedDoctorResponse(UUID id, String name, String specialization, String bio, String email) {

    public static InterestedDoctorResponse from(DoctorAccount doctor) {
        return new InterestedDoctorResponse(
                doctor.getId(),
                doctor.getName(),
                doctor.getSpecialization() != null ? doctor.getSpecialization() : "",
                doctor.getBio() != null ? doctor.getBio() : "",
                doctor.getEmail()
        );
    }
}
