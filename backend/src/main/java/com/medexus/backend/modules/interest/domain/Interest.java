package com.medexus.backend.modules.interest.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

import org.hibernate.annotations.UuidGenerator;

/**
 * A doctor's interest in one surgery request. At most one row per (request, doctor).
 */
@Entity
@Table(
        name = "interest",
        uniqueConstraints = @UniqueConstraint(name = "uq_interest_request_doctor", columnNames = {"request_id", "doctor_id"})
)
public class Interest {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "request_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID requestId;

    @Column(name = "doctor_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID doctorId;

    @Column(name = "expressed_at", nullable = false, updatable = false)
    private OffsetDateTime expressedAt;

    protected Interest() {
    }

    public Interest(UUID requestId, UUID doctorId, OffsetDateTime expressedAt) {
        this.requestId = Objects.requireNonNull(requestId, "requestId");
        this.doctorId = Objects.requireNonNull(doctorId, "doctorId");
        this.expressedAt = Objects.requireNonNull(expressedAt, "expressedAt");
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public UUID getDoctorId() {
        return doctorId;
    }

    public OffsetDateTime getExpressedAt() {
        return expressedAt;
    }
}
