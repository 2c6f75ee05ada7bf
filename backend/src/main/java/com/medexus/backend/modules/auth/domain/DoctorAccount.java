package com.medexus.backend.modules.auth.domain;

import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;

@Entity
@DiscriminatorValue("DOCTOR")
public class DoctorAccount extends MarketUser {

    @Column(name = "specialization", length = 120)
    private String specialization;

    @Column(name = "bio", length = 2000)
    private String bio;

    protected DoctorAccount() {
    }

    public DoctorAccount(String name, String email, String passwordHash, String specialization, String bio) {
        super(name, email, passwordHash);
        this.specialization = Objects.requireNonNull(specialization, "specialization");
        this.bio = bio != null ? bio : "";
    }

    @Override
    public Role getRole() {
        return Role.DOCTOR;
    }

    public String getSpecialization() {
        return specialization;
    }

    public String getBio() {
        return bio;
    }
}
