package com.medexus.backend.modules.interest.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.medexus.backend.global.error.ProblemException;
import com.medexus.backend.global.jpa.ConstraintViolations;
import com.medexus.backend.global.security.AccessPolicy;
import com.medexus.backend.global.security.Capability;
import com.medexus.backend.global.security.JwtAuthenticationPrincipal;
import com.medexus.backend.modules.interest.domain.Interest;
import com.medexus.backend.modules.interest.infrastructure.persistence.InterestRepository;
import com.medexus.backend.modules.interest.presentation.dto.InterestResponse;
import com.medexus.backend.modules.interest.presentation.dto.MyInterestResponse;
import com.medexus.backend.modules.request.application.SurgeryRequestViewComposer;
import com.medexus.backend.modules.request.infrastructure.persistence.SurgeryRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class InterestService {

    private static final Logger log = LoggerFactory.getLogger(InterestService.class);

    static final String UNIQUE_REQUEST_DOCTOR = "uq_interest_request_doctor";
    static final String DOCTOR_FOREIGN_KEY = "fk_interest_doctor";

    private final InterestRepository interestRepository;
    private final SurgeryRequestRepository surgeryRequestRepository;
    private final SurgeryRequestViewComposer viewComposer;
    private final AccessPolicy accessPolicy;
    private final Clock clock;

    public InterestService(
            InterestRepository interestRepository,
            SurgeryRequestRepository surgeryRequestRepository,
            SurgeryRequestViewComposer viewComposer,
            AccessPolicy accessPolicy,
            Clock clock
    ) {
        this.interestRepository = interestRepository;
        this.surgeryRequestRepository = surgeryRequestRepository;
        this.viewComposer = viewComposer;
        this.accessPolicy = accessPolicy;
        this.clock = clock;
    }

    public InterestResponse expressInterest(JwtAuthenticationPrincipal actor, UUID requestId) {
        accessPolicy.require(actor, Capability.EXPRESS_INTEREST);
        UUID doctorId = actor.userId();

        surgeryRequestRepository.findByIdForShare(requestId)
                .orElseThrow(() -> ProblemException.notFound("REQUEST_NOT_FOUND", "Request not found"));

        if (interestRepository.existsByRequestIdAndDoctorId(requestId, doctorId)) {
            throw alreadyExpressed(null);
        }

        Interest saved;
        try {
            saved = interestRepository.saveAndFlush(new Interest(requestId, doctorId, OffsetDateTime.now(clock)));
        } catch (DataIntegrityViolationException ex) {
            if (ConstraintViolations.violates(ex, UNIQUE_REQUEST_DOCTOR)) {
                // a concurrent duplicate reached the unique index first
                throw alreadyExpressed(ex);
            }
            if (ConstraintViolations.violates(ex, DOCTOR_FOREIGN_KEY)) {
                throw new ProblemException(HttpStatus.UNAUTHORIZED, "USER_NOT_FOUND", "User not found", ex);
            }
            throw ex;
        }
        log.info("Doctor {} expressed interest in request {}", doctorId, requestId);
        return InterestResponse.from(saved);
    }

    public void withdrawInterest(JwtAuthenticationPrincipal actor, UUID requestId) {
        accessPolicy.require(actor, Capability.WITHDRAW_INTEREST);
        int removed = interestRepository.deleteByRequestIdAndDoctorId(requestId, actor.userId());
        if (removed == 0) {
            throw ProblemException.notFound("INTEREST_NOT_FOUND", "Interest not found");
        }
        log.info("Doctor {} withdrew interest in request {}", actor.userId(), requestId);
    }

    @Transactional(readOnly = true)
    public List<MyInterestResponse> listMyInterests(JwtAuthenticationPrincipal actor) {
        accessPolicy.require(actor, Capability.VIEW_OWN_INTERESTS);
        return viewComposer.composeDoctorInterests(interestRepository.findByDoctorIdOrderByExpressedAtAsc(actor.userId()));
    }

    @Transactional(readOnly = true)
    public List<InterestResponse> listForRequest(UUID requestId) {
        return interestRepository.findByRequestIdOrderByExpressedAtAsc(requestId).stream()
                .map(InterestResponse::from)
                .toList();
    }

    /**
     * Cascade step of request deletion. Runs inside the caller's transaction.
     */
    public int deleteAllForRequest(UUID requestId) {
        return interestRepository.deleteAllByRequestId(requestId);
    }

    private static ProblemException alreadyExpressed(Throwable cause) {
        return new ProblemException(HttpStatus.CONFLICT, "INTEREST_ALREADY_EXPRESSED",
                "Already expressed interest in this request", cause);
    }
}
