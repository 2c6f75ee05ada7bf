package com.medexus.backend.modules.request.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.medexus.backend.modules.auth.domain.DoctorAccount;
import com.medexus.backend.modules.auth.domain.HospitalAccount;
import com.medexus.backend.modules.auth.infrastructure.persistence.DoctorAccountRepository;
import com.medexus.backend.modules.auth.infrastructure.persistence.HospitalAccountRepository;
import com.medexus.backend.modules.interest.domain.Interest;
import com.medexus.backend.modules.interest.infrastructure.persistence.InterestRepository;
import com.medexus.backend.modules.interest.presentation.dto.InterestResponse;
import com.medexus.backend.modules.interest.presentation.dto.MyInterestResponse;
import com.medexus.backend.modules.request.domain.SurgeryRequest;
import com.medexus.backend.modules.request.infrastructure.persistence.SurgeryRequestRepository;
import com.medexus.backend.modules.request.presentation.dto.InterestedDoctorResponse;
import com.medexus.backend.modules.request.presentation.dto.SurgeryRequestResponse;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-side joins across requests, interests and accounts.
 * Referenced accounts or requests that no longer exist are skipped, not reported.
 */
@Component
@Transactional(readOnly = true)
public class SurgeryRequestViewComposer {

    private final SurgeryRequestRepository surgeryRequestRepository;
    private final InterestRepository interestRepository;
    private final DoctorAccountRepository doctorAccountRepository;
    private final HospitalAccountRepository hospitalAccountRepository;

    public SurgeryRequestViewComposer(
            SurgeryRequestRepository surgeryRequestRepository,
            InterestRepository interestRepository,
            DoctorAccountRepository doctorAccountRepository,
            HospitalAccountRepository hospitalAccountRepository
    ) {
        this.surgeryRequestRepository = surgeryRequestRepository;
        this.interestRepository = interestRepository;
        this.doctorAccountRepository = doctorAccountRepository;
        this.hospitalAccountRepository = hospitalAccountRepository;
    }

    /**
     * Owning hospital's view: each request carries the doctors who expressed interest, in the
     * order they did so.
     */
    public List<SurgeryRequestResponse> composeOwnerView(List<SurgeryRequest> requests) {
        if (requests.isEmpty()) {
            return List.of();
        }
        List<UUID> requestIds = requests.stream().map(SurgeryRequest::getId).toList();
        Map<UUID, List<UUID>> doctorIdsByRequest = new LinkedHashMap<>();
        for (Interest interest : interestRepository.findByRequestIdInOrderByExpressedAtAsc(requestIds)) {
            doctorIdsByRequest.computeIfAbsent(interest.getRequestId(), key -> new ArrayList<>())
                    .add(interest.getDoctorId());
        }

        Set<UUID> doctorIds = doctorIdsByRequest.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        Map<UUID, DoctorAccount> doctors = indexById(doctorAccountRepository.findAllById(doctorIds), DoctorAccount::getId);

        return requests.stream()
                .map(request -> {
                    List<InterestedDoctorResponse> interested = doctorIdsByRequest
                            .getOrDefault(request.getId(), List.of())
                            .stream()
                            .map(doctors::get)
                            .filter(Objects::nonNull)
                            .map(InterestedDoctorResponse::from)
                            .toList();
                    return SurgeryRequestResponse.from(request).withInterestedDoctors(interested);
                })
                .toList();
    }

    public SurgeryRequestResponse composeOwnerView(SurgeryRequest request) {
        return composeOwnerView(List.of(request)).get(0);
    }

    /**
     * Doctor's browse view: hospital name comes from the live account when it still exists,
     * otherwise from the snapshot stored on the request.
     */
    public List<SurgeryRequestResponse> composeBrowseView(List<SurgeryRequest> requests) {
        Map<UUID, String> institutionNames = resolveInstitutionNames(
                requests.stream().map(SurgeryRequest::getHospitalId).collect(Collectors.toSet()));
        return requests.stream()
                .map(request -> SurgeryRequestResponse.from(request)
                        .withHospitalName(institutionNames.getOrDefault(request.getHospitalId(), request.getHospitalName())))
                .toList();
    }

    public SurgeryRequestResponse composeBareView(SurgeryRequest request) {
        return SurgeryRequestResponse.from(request);
    }

    /**
     * Doctor's own interests paired with their requests. Interests whose request is gone are dropped.
     */
    public List<MyInterestResponse> composeDoctorInterests(List<Interest> interests) {
        if (interests.isEmpty()) {
            return List.of();
        }
        Set<UUID> requestIds = interests.stream().map(Interest::getRequestId).collect(Collectors.toSet());
        Map<UUID, SurgeryRequest> requests = indexById(surgeryRequestRepository.findAllById(requestIds), SurgeryRequest::getId);
        Map<UUID, String> institutionNames = resolveInstitutionNames(
                requests.values().stream().map(SurgeryRequest::getHospitalId).collect(Collectors.toSet()));

        List<MyInterestResponse> result = new ArrayList<>();
        for (Interest interest : interests) {
            SurgeryRequest request = requests.get(interest.getRequestId());
            if (request == null) {
                continue;
            }
            String hospitalName = institutionNames.getOrDefault(request.getHospitalId(), request.getHospitalName());
            result.add(new MyInterestResponse(
                    InterestResponse.from(interest),
                    SurgeryRequestResponse.from(request).withHospitalName(hospitalName)
            ));
        }
        return result;
    }

    private Map<UUID, String> resolveInstitutionNames(Collection<UUID> hospitalIds) {
        if (hospitalIds.isEmpty()) {
            return Map.of();
        }
        Map<UUID, String> names = new LinkedHashMap<>();
        for (HospitalAccount hospital : hospitalAccountRepository.findAllById(hospitalIds)) {
            names.put(hospital.getId(), hospital.getInstitutionName());
        }
        return names;
    }

    private static <T> Map<UUID, T> indexById(Iterable<T> entities, Function<T, UUID> idExtractor) {
        Map<UUID, T> indexed = new LinkedHashMap<>();
        for (T entity : entities) {
            indexed.put(idExtractor.apply(entity), entity);
        }
        return indexed;
    }
}
