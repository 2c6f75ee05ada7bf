package com.medexus.backend.global.config;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Validates required configuration once the application is ready.
 * Missing keys or invalid values abort startup.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEFAULT_DEV_SECRET = "medexus-dev-jwt-secret-change-in-production-2025";
    private static final long MIN_EXPIRATION_MILLIS = 300_000L;
    private static final long MAX_EXPIRATION_MILLIS = 30L * 24 * 60 * 60 * 1000;
    private static final int MIN_SECRET_BYTES = 32;

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "app.cors.allowed-origins",
            "server.port"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = collectProblems();
        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Configuration problem: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }

        if (DEFAULT_DEV_SECRET.equals(environment.getProperty("jwt.secret"))) {
            log.warn("jwt.secret is the development default; set JWT_SECRET before deploying");
        }
        log.info("Environment validation passed");
    }

    List<String> collectProblems() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add("missing " + key);
            }
        }

        Optional.ofNullable(environment.getProperty("jwt.secret"))
                .filter(secret -> !secret.isBlank())
                .filter(secret -> secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES)
                .ifPresent(secret -> problems.add("jwt.secret must be at least " + MIN_SECRET_BYTES + " bytes"));

        Optional<String> expiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (expiration.isPresent() && !expiration.get().isBlank()) {
            try {
                long millis = Long.parseLong(expiration.get().trim());
                if (millis < MIN_EXPIRATION_MILLIS || millis > MAX_EXPIRATION_MILLIS) {
                    problems.add("jwt.expiration must be between " + MIN_EXPIRATION_MILLIS
                            + " and " + MAX_EXPIRATION_MILLIS + " milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration must be a number");
            }
        }
        return problems;
    }
}
