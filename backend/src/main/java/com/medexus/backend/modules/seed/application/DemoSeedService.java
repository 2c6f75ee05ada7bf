package com.medexus.backend.modules.seed.application;

import java.util.List;

import com.medexus.backend.modules.auth.domain.DoctorAccount;
import com.medexus.backend.modules.auth.domain.HospitalAccount;
import com.medexus.backend.modules.auth.infrastructure.persistence.MarketUserRepository;
import com.medexus.backend.modules.interest.infrastructure.persistence.InterestRepository;
import com.medexus.backend.modules.request.domain.SurgeryRequest;
import com.medexus.backend.modules.request.domain.SurgeryRequestDetails;
import com.medexus.backend.modules.request.infrastructure.persistence.SurgeryRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Replaces all marketplace data with a fixed demo set. Only registered when
 * {@code app.seed.enabled=true}.
 */
@Service
@ConditionalOnProperty(value = "app.seed.enabled", havingValue = "true")
public class DemoSeedService {

    private static final Logger log = LoggerFactory.getLogger(DemoSeedService.class);

    static final String HOSPITAL_PASSWORD = "hospital123";
    static final String DOCTOR_PASSWORD = "doctor123";
    static final String HOSPITAL_LOGIN = "admin@cityhospital.com";
    static final String DOCTOR_LOGIN = "james.wilson@medexus.com";

    private final MarketUserRepository marketUserRepository;
    private final SurgeryRequestRepository surgeryRequestRepository;
    private final InterestRepository interestRepository;
    private final PasswordEncoder passwordEncoder;

    public DemoSeedService(
            MarketUserRepository marketUserRepository,
            SurgeryRequestRepository surgeryRequestRepository,
            InterestRepository interestRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.marketUserRepository = marketUserRepository;
        this.surgeryRequestRepository = surgeryRequestRepository;
        this.interestRepository = interestRepository;
        this.passwordEncoder = passwordEncoder;
    }

    @Transactional
    public SeedSummary resetDemoDataset() {
        interestRepository.deleteAllInBatch();
        surgeryRequestRepository.deleteAllInBatch();
        marketUserRepository.deleteAllInBatch();

        String hospitalHash = passwordEncoder.encode(HOSPITAL_PASSWORD);
        String doctorHash = passwordEncoder.encode(DOCTOR_PASSWORD);

        List<HospitalAccount> hospitals = marketUserRepository.saveAll(List.of(
                new HospitalAccount("Dr. Sarah Johnson", HOSPITAL_LOGIN, hospitalHash, "City General Hospital"),
                new HospitalAccount("Dr. Michael Chen", "admin@valleymed.com", hospitalHash, "Valley Medical Center"),
                new HospitalAccount("Dr. Emily Rodriguez", "admin@regionalhospital.com", hospitalHash, "Regional Health Hospital")
        ));

        List<DoctorAccount> doctors = marketUserRepository.saveAll(List.of(
                new DoctorAccount("Dr. James Wilson", DOCTOR_LOGIN, doctorHash, "Orthopedic Surgeon",
                        "15+ years experience in joint replacement and trauma surgery"),
                new DoctorAccount("Dr. Lisa Anderson", "lisa.anderson@medexus.com", doctorHash, "Cardiologist",
                        "Specialized in cardiac surgery and interventional cardiology"),
                new DoctorAccount("Dr. Robert Kumar", "robert.kumar@medexus.com", doctorHash, "General Surgeon",
                        "Expert in minimally invasive surgical techniques"),
                new DoctorAccount("Dr. Maria Garcia", "maria.garcia@medexus.com", doctorHash, "Neurologist",
                        "Specialized in neurosurgery and brain tumor treatments"),
                new DoctorAccount("Dr. David Park", "david.park@medexus.com", doctorHash, "Orthopedic Surgeon",
                        "Sports medicine and arthroscopic surgery specialist")
        ));

        List<SurgeryRequest> requests = surgeryRequestRepository.saveAll(List.of(
                new SurgeryRequest(hospitals.get(0).getId(), new SurgeryRequestDetails(
                        "Hip Replacement", "Orthopedic Surgeon", "High", "2025-03-20", "Springfield, IL",
                        "City General Hospital",
                        "Elderly patient with severe hip arthritis requiring urgent replacement")),
                new SurgeryRequest(hospitals.get(1).getId(), new SurgeryRequestDetails(
                        "Cardiac Bypass", "Cardiologist", "Medium", "2025-03-25", "Madison, WI",
                        "Valley Medical Center",
                        "Patient with blocked arteries needs bypass surgery")),
                new SurgeryRequest(hospitals.get(2).getId(), new SurgeryRequestDetails(
                        "Appendectomy", "General Surgeon", "High", "2025-03-15", "Cedar Falls, IA",
                        "Regional Health Hospital",
                        "Emergency appendectomy needed for acute appendicitis"))
        ));

        log.info("Demo dataset reset: {} hospitals, {} doctors, {} requests",
                hospitals.size(), doctors.size(), requests.size());
        return new SeedSummary(
                hospitals.size(),
                doctors.size(),
                requests.size(),
                new SeedLogin(HOSPITAL_LOGIN, HOSPITAL_PASSWORD),
                new SeedLogin(DOCTOR_LOGIN, DOCTOR_PASSWORD)
        );
    }

    public record SeedSummary(int hospitals, int doctors, int sampleRequests, SeedLogin hospitalLogin, SeedLogin doctorLogin) {
    }

    public record SeedLogin(String email, String password) {
    }
}
