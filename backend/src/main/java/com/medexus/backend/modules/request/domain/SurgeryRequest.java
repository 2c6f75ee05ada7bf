package com.medexus.backend.modules.request.domain;

import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.UUID;

import com.medexus.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A hospital's posted need for a surgeon. Owned by exactly one hospital account.
 */
@Entity
@Table(name = "surgery_request")
public class SurgeryRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "hospital_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID hospitalId;

    @Column(name = "surgery_type", nullable = false, length = 200)
    private String surgeryType;

    @Column(name = "required_specialization", nullable = false, length = 120)
    private String requiredSpecialization;

    @Column(name = "urgency", nullable = false, length = 32)
    private String urgency;

    @Column(name = "surgery_date", nullable = false, length = 64)
    private String date;

    @Column(name = "location", nullable = false, length = 200)
    private String location;

    @Column(name = "hospital_name", nullable = false, length = 200)
    private String hospitalName;

    @Column(name = "condition_description", nullable = false, length = 4000)
    private String conditionDescription;

    @Column(name = "updated_at")
    private OffsetDateTime updatedAt;

    protected SurgeryRequest() {
    }

    public SurgeryRequest(UUID hospitalId, SurgeryRequestDetails details) {
        this.hospitalId = Objects.requireNonNull(hospitalId, "hospitalId");
        apply(details);
    }

    public void replaceDetails(SurgeryRequestDetails details, OffsetDateTime updatedAt) {
        apply(details);
        this.updatedAt = updatedAt;
    }

    private void apply(SurgeryRequestDetails details) {
        this.surgeryType = details.surgeryType();
        this.requiredSpecialization = details.requiredSpecialization();
        this.urgency = details.urgency();
        this.date = details.date();
        this.location = details.location();
        this.hospitalName = details.hospitalName();
        this.conditionDescription = details.conditionDescription();
    }

    public UUID getId() {
        return id;
    }

    public UUID getHospitalId() {
        return hospitalId;
    }

    public String getSurgeryType() {
        return surgeryType;
    }

    public String getRequiredSpecialization() {
        return requiredSpecialization;
    }

    public String getUrgency() {
        return urgency;
    }

    public String getDate() {
        return date;
    }

    public String getLocation() {
        return location;
    }

    public String getHospitalName() {
        return hospitalName;
    }

    public String getConditionDescription() {
        return conditionDescription;
    }

    public OffsetDateTime getUpdatedAt() {
        return updatedAt;
    }
}
