package com.medexus.backend.modules.request.domain;

/**
 * Descriptive fields of a surgery request, replaced as a whole on update.
 * Urgency and date are free-form text.
 */
public record SurgeryRequestDetails(
        String surgeryType,
        String requiredSpecialization,
        String urgency,
        String date,
        String location,
        String hospitalName,
        String conditionDescription
) {

    public SurgeryRequestDetails {
        if (conditionDescription == null) {
            conditionDescription = "";
        }
    }
}
