package com.medexus.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.medexus.backend.modules.auth.domain.HospitalAccount;

import org.springframework.data.jpa.repository.JpaRepository;

public interface HospitalAccountRepository extends JpaRepository<HospitalAccount, UUID> {
}
