package com.medexus.backend.modules.interest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.medexus.backend.global.error.ProblemException;
import com.medexus.backend.global.security.AccessPolicy;
import com.medexus.backend.global.security.JwtAuthenticationPrincipal;
import com.medexus.backend.modules.auth.domain.Role;
import com.medexus.backend.modules.interest.application.InterestService;
import com.medexus.backend.modules.interest.domain.Interest;
import com.medexus.backend.modules.interest.infrastructure.persistence.InterestRepository;
import com.medexus.backend.modules.interest.presentation.dto.InterestResponse;
import com.medexus.backend.modules.request.application.SurgeryRequestViewComposer;
import com.medexus.backend.modules.request.domain.SurgeryRequest;
import com.medexus.backend.modules.request.domain.SurgeryRequestDetails;
import com.medexus.backend.modules.request.infrastructure.persistence.SurgeryRequestRepository;
import com.medexus.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class InterestServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-03-02T08:00:00Z");

    @Mock
    private InterestRepository interestRepository;

    @Mock
    private SurgeryRequestRepository surgeryRequestRepository;

    @Mock
    private SurgeryRequestViewComposer viewComposer;

    private InterestService interestService;

    private JwtAuthenticationPrincipal doctor;
    private SurgeryRequest request;

    @BeforeEach
    void setUp() {
        interestService = new InterestService(
                interestRepository,
                surgeryRequestRepository,
                viewComposer,
                new AccessPolicy(),
                Clock.fixed(NOW.toInstant(), ZoneOffset.UTC)
        );
        doctor = new JwtAuthenticationPrincipal(UUID.randomUUID(), "doc@medexus.com", Role.DOCTOR);
        request = TestEntities.withId(new SurgeryRequest(UUID.randomUUID(), new SurgeryRequestDetails(
                "Appendectomy", "General Surgeon", "High", "2025-03-15", "Cedar Falls, IA", "Regional", null)),
                UUID.randomUUID());
    }

    @Test
    void expressInterestRecordsClockTime() {
        when(surgeryRequestRepository.findByIdForShare(request.getId())).thenReturn(Optional.of(request));
        when(interestRepository.existsByRequestIdAndDoctorId(request.getId(), doctor.userId())).thenReturn(false);
        when(interestRepository.saveAndFlush(any(Interest.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0), UUID.randomUUID()));

        InterestResponse response = interestService.expressInterest(doctor, request.getId());

        assertThat(response.requestId()).isEqualTo(request.getId());
        assertThat(response.doctorId()).isEqualTo(doctor.userId());
        assertThat(response.timestamp()).isEqualTo(NOW);
    }

    @Test
    void uniqueIndexViolationIsReportedAsConflict() {
        when(surgeryRequestRepository.findByIdForShare(request.getId())).thenReturn(Optional.of(request));
        when(interestRepository.existsByRequestIdAndDoctorId(request.getId(), doctor.userId())).thenReturn(false);
        when(interestRepository.saveAndFlush(any(Interest.class)))
                .thenThrow(new DataIntegrityViolationException("uq_interest_request_doctor"));

        assertThatThrownBy(() -> interestService.expressInterest(doctor, request.getId()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("INTEREST_ALREADY_EXPRESSED");
                });
    }

    @Test
    void doctorForeignKeyViolationIsReportedAsMissingUser() {
        when(surgeryRequestRepository.findByIdForShare(request.getId())).thenReturn(Optional.of(request));
        when(interestRepository.existsByRequestIdAndDoctorId(request.getId(), doctor.userId())).thenReturn(false);
        when(interestRepository.saveAndFlush(any(Interest.class)))
                .thenThrow(new DataIntegrityViolationException(
                        "insert or update on table \"interest\" violates foreign key constraint \"fk_interest_doctor\""));

        assertThatThrownBy(() -> interestService.expressInterest(doctor, request.getId()))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
                    assertThat(ex.getCode()).isEqualTo("USER_NOT_FOUND");
                });
    }

    @Test
    void unrelatedIntegrityViolationIsNotMasked() {
        DataIntegrityViolationException violation = new DataIntegrityViolationException("value too long for column");
        when(surgeryRequestRepository.findByIdForShare(request.getId())).thenReturn(Optional.of(request));
        when(interestRepository.existsByRequestIdAndDoctorId(request.getId(), doctor.userId())).thenReturn(false);
        when(interestRepository.saveAndFlush(any(Interest.class))).thenThrow(violation);

        assertThatThrownBy(() -> interestService.expressInterest(doctor, request.getId()))
                .isSameAs(violation);
    }

    @Test
    void missingRequestIsNotFound() {
        UUID missing = UUID.randomUUID();
        when(surgeryRequestRepository.findByIdForShare(missing)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> interestService.expressInterest(doctor, missing))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
        verify(interestRepository, never()).saveAndFlush(any());
    }

    @Test
    void withdrawWithNothingDeletedIsNotFound() {
        when(interestRepository.deleteByRequestIdAndDoctorId(request.getId(), doctor.userId())).thenReturn(0);

        assertThatThrownBy(() -> interestService.withdrawInterest(doctor, request.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("INTEREST_NOT_FOUND"));
    }

    @Test
    void hospitalCannotWithdraw() {
        JwtAuthenticationPrincipal hospital = new JwtAuthenticationPrincipal(UUID.randomUUID(), "h@medexus.com", Role.HOSPITAL);

        assertThatThrownBy(() -> interestService.withdrawInterest(hospital, request.getId()))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
        verify(interestRepository, never()).deleteByRequestIdAndDoctorId(any(), any());
    }
}
