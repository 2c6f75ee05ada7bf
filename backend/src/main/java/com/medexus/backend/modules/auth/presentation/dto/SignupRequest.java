package com.medexus.backend.modules.auth.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SignupRequest(
        @NotBlank(message = "name is required") @Size(max = 100) String name,
        @NotBlank(message = "email is required") @Email(message = "email must be valid") @Size(max = 320) String email,
        @NotBlank(message = "password is required") @Size(max = 128) String password,
        @NotBlank(message = "role is required") String role,
        @Size(max = 200) String institutionName,
        @Size(max = 120) String specialization,
        @Size(max = 2000) String bio
) {
}
