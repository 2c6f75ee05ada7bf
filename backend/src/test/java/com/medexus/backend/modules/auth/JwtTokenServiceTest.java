package com.medexus.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import com.medexus.backend.modules.auth.application.JwtTokenService;
import com.medexus.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.medexus.backend.modules.auth.application.JwtTokenService.ParsedToken;
import com.medexus.backend.modules.auth.domain.Role;
import com.medexus.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.medexus.backend.modules.auth.presentation.dto.AccessToken;

import org.junit.jupiter.api.Test;

class JwtTokenServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-for-hs256";
    private static final long ONE_HOUR = Duration.ofHours(1).toMillis();
    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET);

    @Test
    void issuedTokenCarriesIdentityAndRole() {
        JwtTokenService service = new JwtTokenService(provider, ONE_HOUR, Clock.fixed(NOW, ZoneOffset.UTC));
        UUID userId = UUID.randomUUID();

        AccessToken token = service.issueAccessToken(userId, "doc@medexus.com", Role.DOCTOR);
        ParsedToken parsed = service.parseAccessToken(token.accessToken());

        assertThat(token.expiresIn()).isEqualTo(3600);
        assertThat(parsed.userId()).isEqualTo(userId);
        assertThat(parsed.email()).isEqualTo("doc@medexus.com");
        assertThat(parsed.role()).isEqualTo(Role.DOCTOR);
        assertThat(parsed.expiresAt().toInstant()).isEqualTo(NOW.plusMillis(ONE_HOUR));
    }

    @Test
    void expiredTokenIsRejected() {
        JwtTokenService issuer = new JwtTokenService(provider, ONE_HOUR, Clock.fixed(NOW, ZoneOffset.UTC));
        String token = issuer.issueAccessToken(UUID.randomUUID(), "h@medexus.com", Role.HOSPITAL).accessToken();

        JwtTokenService later = new JwtTokenService(provider, ONE_HOUR,
                Clock.fixed(NOW.plus(Duration.ofHours(2)), ZoneOffset.UTC));

        assertThatThrownBy(() -> later.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        JwtTokenService foreign = new JwtTokenService(
                new JwtTokenProvider("another-secret-that-is-also-long-enough-for-hs256"), ONE_HOUR, clock);
        String token = foreign.issueAccessToken(UUID.randomUUID(), "h@medexus.com", Role.HOSPITAL).accessToken();

        JwtTokenService service = new JwtTokenService(provider, ONE_HOUR, clock);

        assertThatThrownBy(() -> service.parseAccessToken(token)).isInstanceOf(InvalidTokenException.class);
        assertThatThrownBy(() -> service.parseAccessToken("not-a-jwt")).isInstanceOf(InvalidTokenException.class);
    }
}
