package com.medexus.backend.modules.auth.domain;

import java.util.Objects;

import jakarta.persistence.Column;
import jakarta.persistence.DiscriminatorValue;
import jakarta.persistence.Entity;

@Entity
@DiscriminatorValue("HOSPITAL")
public class HospitalAccount extends MarketUser {

    @Column(name = "institution_name", length = 200)
    private String institutionName;

    protected HospitalAccount() {
    }

    public HospitalAccount(String name, String email, String passwordHash, String institutionName) {
        super(name, email, passwordHash);
        this.institutionName = Objects.requireNonNull(institutionName, "institutionName");
    }

    @Override
    public Role getRole() {
        return Role.HOSPITAL;
    }

    public String getInstitutionName() {
        return institutionName;
    }
}
