package com.medexus.backend.modules.interest.infrastructure.persistence;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

import com.medexus.backend.modules.interest.domain.Interest;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface InterestRepository extends JpaRepository<Interest, UUID> {

    boolean existsByRequestIdAndDoctorId(UUID requestId, UUID doctorId);

    List<Interest> findByDoctorIdOrderByExpressedAtAsc(UUID doctorId);

    List<Interest> findByRequestIdOrderByExpressedAtAsc(UUID requestId);

    List<Interest> findByRequestIdInOrderByExpressedAtAsc(Collection<UUID> requestIds);

    @Modifying
    @Query("delete from Interest i where i.requestId = :requestId and i.doctorId = :doctorId")
    int deleteByRequestIdAndDoctorId(@Param("requestId") UUID requestId, @Param("doctorId") UUID doctorId);

    @Modifying
    @Query("delete from Interest i where i.requestId = :requestId")
    int deleteAllByRequestId(@Param("requestId") UUID requestId);
}
