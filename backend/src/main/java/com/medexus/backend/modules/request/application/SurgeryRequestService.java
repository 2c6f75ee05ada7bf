package com.medexus.backend.modules.request.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medexus.backend.global.error.ProblemException;
import com.medexus.backend.global.security.AccessPolicy;
import com.medexus.backend.global.security.Capability;
import com.medexus.backend.global.security.JwtAuthenticationPrincipal;
import com.medexus.backend.modules.auth.domain.HospitalAccount;
import com.medexus.backend.modules.auth.domain.Role;
import com.medexus.backend.modules.auth.infrastructure.persistence.HospitalAccountRepository;
import com.medexus.backend.modules.interest.application.InterestService;
import com.medexus.backend.modules.request.domain.SurgeryRequest;
import com.medexus.backend.modules.request.domain.SurgeryRequestDetails;
import com.medexus.backend.modules.request.infrastructure.persistence.SurgeryRequestRepository;
import com.medexus.backend.modules.request.presentation.dto.SurgeryRequestPayload;
import com.medexus.backend.modules.request.presentation.dto.SurgeryRequestResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class SurgeryRequestService {

    private static final Logger log = LoggerFactory.getLogger(SurgeryRequestService.class);

    private final SurgeryRequestRepository surgeryRequestRepository;
    private final HospitalAccountRepository hospitalAccountRepository;
    private final InterestService interestService;
    private final SurgeryRequestViewComposer viewComposer;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public SurgeryRequestService(
            SurgeryRequestRepository surgeryRequestRepository,
            HospitalAccountRepository hospitalAccountRepository,
            InterestService interestService,
            SurgeryRequestViewComposer viewComposer,
            AccessPolicy accessPolicy,
            Clock clock
    ) {
        this.surgeryRequestRepository = surgeryRequestRepository;
        this.hospitalAccountRepository = hospitalAccountRepository;
        this.interestService = interestService;
        this.viewComposer = viewComposer;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    public SurgeryRequestResponse createRequest(JwtAuthenticationPrincipal actor, SurgeryRequestPayload payload) {
        accessPolicy.require(actor, Capability.CREATE_REQUEST);
        HospitalAccount hospital = requireHospital(actor.userId());

        SurgeryRequest request = new SurgeryRequest(hospital.getId(), toDetails(payload, hospital));
        SurgeryRequest saved = surgeryRequestRepository.save(request);
        log.info("Surgery request {} created by hospital {}", saved.getId(), hospital.getId());
        return viewComposer.composeBareView(saved);
    }

    @Transactional(readOnly = true)
    public List<SurgeryRequestResponse> listRequests(JwtAuthenticationPrincipal actor) {
        if (actor.hasRole(Role.HOSPITAL)) {
            return viewComposer.composeOwnerView(surgeryRequestRepository.findByHospitalIdOrderByCreatedAtAsc(actor.userId()));
        }
        return viewComposer.composeBrowseView(surgeryRequestRepository.findAllByOrderByCreatedAtAsc());
    }

    @Transactional(readOnly = true)
    public SurgeryRequestResponse getRequest(JwtAuthenticationPrincipal actor, UUID requestId) {
        SurgeryRequest request = findRequest(requestId);
        if (actor.hasRole(Role.HOSPITAL) && accessPolicy.isOwner(actor, request.getHospitalId())) {
            return viewComposer.composeOwnerView(request);
        }
        return viewComposer.composeBareView(request);
    }

    public SurgeryRequestResponse updateRequest(JwtAuthenticationPrincipal actor, UUID requestId, SurgeryRequestPayload payload) {
        accessPolicy.require(actor, Capability.UPDATE_REQUEST);
        SurgeryRequest request = findRequest(requestId);
        accessPolicy.requireOwner(actor, request.getHospitalId(), Capability.UPDATE_REQUEST);

        HospitalAccount hospital = requireHospital(actor.userId());
        request.replaceDetails(toDetails(payload, hospital), OffsetDateTime.now(clock));
        SurgeryRequest saved = surgeryRequestRepository.save(request);
        return viewComposer.composeOwnerView(saved);
    }

    /**
     * Removes the request and every interest attached to it in one transaction.
     * Interests go first; the foreign key cascade covers any row inserted in between.
     */
    public void deleteRequest(JwtAuthenticationPrincipal actor, UUID requestId) {
        accessPolicy.require(actor, Capability.DELETE_REQUEST);
        SurgeryRequest request = findRequest(requestId);
        accessPolicy.requireOwner(actor, request.getHospitalId(), Capability.DELETE_REQUEST);

        int removedInterests = interestService.deleteAllForRequest(requestId);
        surgeryRequestRepository.delete(request);
        surgeryRequestRepository.flush();
        log.info("Surgery request {} deleted by hospital {} ({} interests removed)", requestId, actor.userId(), removedInterests);
    }

    private SurgeryRequest findRequest(UUID requestId) {
        return surgeryRequestRepository.findById(requestId)
                .orElseThrow(() -> ProblemException.notFound("REQUEST_NOT_FOUND", "Request not found"));
    }

    private HospitalAccount requireHospital(UUID hospitalId) {
        return hospitalAccountRepository.findById(hospitalId)
                .orElseThrow(() -> new ProblemException(HttpStatus.UNAUTHORIZED, "USER_NOT_FOUND", "User not found"));
    }

    private static SurgeryRequestDetails toDetails(SurgeryRequestPayload payload, HospitalAccount hospital) {
        String hospitalName = StringUtils.hasText(payload.hospitalName())
                ? payload.hospitalName()
                : hospital.getInstitutionName();
        return new SurgeryRequestDetails(
                payload.surgeryType(),
                payload.requiredSpecialization(),
                payload.urgency(),
                payload.date(),
                payload.location(),
                hospitalName,
                payload.conditionDescription()
        );
    }
}
