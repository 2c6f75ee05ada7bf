package com.medexus.backend.modules.auth.infrastructure.persistence;

import java.util.UUID;

import com.medexus.backend.modules.auth.domain.DoctorAccount;

import org.springframework.data.jpa.repository.JpaRepository;

public interface DoctorAccountRepository extends JpaRepository<DoctorAccount, UUID> {
}
