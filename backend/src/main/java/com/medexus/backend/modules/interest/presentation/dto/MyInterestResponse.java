package com.medexus.backend.modules.interest.presentation.dto;

import com.medexus.backend.modules.request.presentation.dto.SurgeryRequestResponse;

public record MyInterestResponse(InterestResponse interest, SurgeryRequestResponse request) {
}
