package com.medexus.backend.modules.auth.application;

import java.util.Locale;
import java.util.UUID;

import com.medexus.backend.global.error.ProblemException;
import com.medexus.backend.global.jpa.ConstraintViolations;
import com.medexus.backend.modules.auth.domain.DoctorAccount;
import com.medexus.backend.modules.auth.domain.HospitalAccount;
import com.medexus.backend.modules.auth.domain.MarketUser;
import com.medexus.backend.modules.auth.domain.Role;
import com.medexus.backend.modules.auth.infrastructure.persistence.MarketUserRepository;
import com.medexus.backend.modules.auth.presentation.dto.AccessToken;
import com.medexus.backend.modules.auth.presentation.dto.AuthResponse;
import com.medexus.backend.modules.auth.presentation.dto.LoginRequest;
import com.medexus.backend.modules.auth.presentation.dto.SignupRequest;
import com.medexus.backend.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final MarketUserRepository marketUserRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenService jwtTokenService;

    public AuthService(
            MarketUserRepository marketUserRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenService jwtTokenService
    ) {
        this.marketUserRepository = marketUserRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenService = jwtTokenService;
    }

    public AuthResponse signup(SignupRequest request) {
        String email = normalizeEmail(request.email());
        if (marketUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("EMAIL_ALREADY_REGISTERED", "Email already registered");
        }

        Role role = Role.fromCode(request.role())
                .orElseThrow(() -> ProblemException.badRequest("INVALID_ROLE", "Role must be 'hospital' or 'doctor'"));

        String passwordHash = passwordEncoder.encode(request.password());
        MarketUser user = switch (role) {
            case HOSPITAL -> new HospitalAccount(
                    request.name().trim(),
                    email,
                    passwordHash,
                    requireText(request.institutionName(), "INSTITUTION_NAME_REQUIRED",
                            "Institution name required for hospitals")
            );
            case DOCTOR -> new DoctorAccount(
                    request.name().trim(),
                    email,
                    passwordHash,
                    requireText(request.specialization(), "SPECIALIZATION_REQUIRED",
                            "Specialization required for doctors"),
                    request.bio()
            );
        };

        MarketUser saved;
        try {
            saved = marketUserRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException ex) {
            if (!ConstraintViolations.violates(ex, "uq_market_user_email")) {
                throw ex;
            }
            // concurrent signup with the same email lost the race on the unique index
            throw new ProblemException(HttpStatus.CONFLICT, "EMAIL_ALREADY_REGISTERED", "Email already registered", ex);
        }

        log.info("Registered {} account {}", role.getCode(), saved.getId());
        return issueFor(saved);
    }

    @Transactional(readOnly = true)
    public AuthResponse login(LoginRequest request) {
        MarketUser user = marketUserRepository.findByEmailIgnoreCase(normalizeEmail(request.email()))
                .orElseThrow(AuthService::invalidCredentials);

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw invalidCredentials();
        }
        return issueFor(user);
    }

    @Transactional(readOnly = true)
    public UserProfileResponse loadProfile(UUID userId) {
        MarketUser user = marketUserRepository.findById(userId)
                .orElseThrow(() -> ProblemException.notFound("USER_NOT_FOUND", "User not found"));
        return UserProfileResponse.from(user);
    }

    private AuthResponse issueFor(MarketUser user) {
        AccessToken token = jwtTokenService.issueAccessToken(user.getId(), user.getEmail(), user.getRole());
        return AuthResponse.of(token, UserProfileResponse.from(user));
    }

    private static ProblemException invalidCredentials() {
        return new ProblemException(HttpStatus.UNAUTHORIZED, "INVALID_CREDENTIALS", "Incorrect email or password");
    }

    private static String requireText(String value, String code, String message) {
        if (!StringUtils.hasText(value)) {
            throw ProblemException.badRequest(code, message);
        }
        return value.trim();
    }

    private static String normalizeEmail(String rawEmail) {
        return rawEmail == null ? null : rawEmail.trim().toLowerCase(Locale.ROOT);
    }
}
