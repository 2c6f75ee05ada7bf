package com.medexus.backend.modules.request.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.medexus.backend.modules.request.domain.SurgeryRequest;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SurgeryRequestRepository extends JpaRepository<SurgeryRequest, UUID> {

    List<SurgeryRequest> findByHospitalIdOrderByCreatedAtAsc(UUID hospitalId);

    List<SurgeryRequest> findAllByOrderByCreatedAtAsc();

    /**
     * Holds a shared row lock so the request cannot be deleted while an interest is being attached.
     */
    @Lock(LockModeType.PESSIMISTIC_READ)
    @Query("select sr from SurgeryRequest sr where sr.id = :id")
    Optional<SurgeryRequest> findByIdForShare(@Param("id") UUID id);
}
