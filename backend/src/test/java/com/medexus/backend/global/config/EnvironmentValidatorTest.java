package com.medexus.backend.global.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    private static MockEnvironment validEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/medexus")
                .withProperty("jwt.secret", EnvironmentValidator.DEFAULT_DEV_SECRET)
                .withProperty("jwt.expiration", "2592000000")
                .withProperty("app.cors.allowed-origins", "http://localhost:3000")
                .withProperty("server.port", "8001");
    }

    @Test
    void acceptsDefaults() {
        EnvironmentValidator validator = new EnvironmentValidator(validEnvironment());

        assertThat(validator.collectProblems()).isEmpty();
        assertThatCode(validator::validateEnvironment).doesNotThrowAnyException();
    }

    @Test
    void reportsMissingKeysAndShortSecret() {
        MockEnvironment environment = validEnvironment()
                .withProperty("jwt.secret", "too-short")
                .withProperty("app.cors.allowed-origins", " ");

        EnvironmentValidator validator = new EnvironmentValidator(environment);

        assertThat(validator.collectProblems())
                .contains("missing app.cors.allowed-origins")
                .anyMatch(problem -> problem.startsWith("jwt.secret must be at least"));
        assertThatThrownBy(validator::validateEnvironment).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsExpirationOutsideBounds() {
        EnvironmentValidator tooShort = new EnvironmentValidator(validEnvironment().withProperty("jwt.expiration", "1000"));
        EnvironmentValidator notNumber = new EnvironmentValidator(validEnvironment().withProperty("jwt.expiration", "soon"));

        assertThat(tooShort.collectProblems()).anyMatch(problem -> problem.startsWith("jwt.expiration must be between"));
        assertThat(notNumber.collectProblems()).containsExactly("jwt.expiration must be a number");
    }
}
