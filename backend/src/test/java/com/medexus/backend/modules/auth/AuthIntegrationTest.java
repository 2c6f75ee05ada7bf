package com.medexus.backend.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.medexus.backend.modules.auth.domain.MarketUser;
import com.medexus.backend.modules.auth.infrastructure.persistence.MarketUserRepository;
import com.medexus.backend.support.AbstractIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

class AuthIntegrationTest extends AbstractIntegrationTest {

    @Autowired
    private MarketUserRepository marketUserRepository;

    @Test
    void hospitalSignupReturnsTokenAndProfile() throws Exception {
        JsonNode response = signup("""
                {
                  "name": "Dr. Sarah Johnson",
                  "email": "Admin@CityHospital.com",
                  "password": "hospital123",
                  "role": "hospital",
                  "institution_name": "City General Hospital"
                }
                """);

        assertThat(response.path("access_token").asText()).isNotBlank();
        assertThat(response.path("token_type").asText()).isEqualTo("bearer");
        assertThat(response.path("user").path("role").asText()).isEqualTo("hospital");
        assertThat(response.path("user").path("email").asText()).isEqualTo("admin@cityhospital.com");
        assertThat(response.path("user").path("institution_name").asText()).isEqualTo("City General Hospital");
        assertThat(response.path("user").has("password_hash")).isFalse();

        MarketUser stored = marketUserRepository.findByEmailIgnoreCase("admin@cityhospital.com").orElseThrow();
        assertThat(stored.getPasswordHash()).isNotEqualTo("hospital123");
    }

    @Test
    void doctorSignupWithoutBioStoresEmptyBio() throws Exception {
        JsonNode response = signup("""
                {
                  "name": "Dr. James Wilson",
                  "email": "james@medexus.com",
                  "password": "doctor123",
                  "role": "doctor",
                  "specialization": "Orthopedic Surgeon"
                }
                """);

        assertThat(response.path("user").path("role").asText()).isEqualTo("doctor");
        assertThat(response.path("user").path("specialization").asText()).isEqualTo("Orthopedic Surgeon");
        assertThat(response.path("user").path("bio").asText()).isEmpty();
    }

    @Test
    void signupWithRegisteredEmailIsConflict() throws Exception {
        testUserFactory.createHospital("taken@medexus.com", "Taken Hospital");

        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "Dr. Copy",
                                  "email": "TAKEN@medexus.com",
                                  "password": "doctor123",
                                  "role": "doctor",
                                  "specialization": "Cardiologist"
                                }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("EMAIL_ALREADY_REGISTERED"));

        assertThat(marketUserRepository.count()).isEqualTo(1);
    }

    @Test
    void signupRejectsUnknownRole() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "Nurse",
                                  "email": "nurse@medexus.com",
                                  "password": "nurse123",
                                  "role": "nurse"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ROLE"));
    }

    @Test
    void hospitalSignupRequiresInstitutionName() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "name": "Dr. Nobody",
                                  "email": "nobody@hospital.com",
                                  "password": "hospital123",
                                  "role": "hospital"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INSTITUTION_NAME_REQUIRED"));

        assertThat(marketUserRepository.count()).isZero();
    }

    @Test
    void signupWithMissingFieldsIsValidationError() throws Exception {
        mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "email": "not-an-email",
                                  "role": "doctor"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("validation_error"));
    }

    @Test
    void loginWithCorrectPasswordReturnsToken() throws Exception {
        testUserFactory.createDoctor("lisa@medexus.com", "Cardiologist");

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "LISA@medexus.com", "password": "secret123"}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.access_token").isNotEmpty())
                .andExpect(jsonPath("$.user.email").value("lisa@medexus.com"))
                .andExpect(jsonPath("$.user.role").value("doctor"));
    }

    @Test
    void loginFailuresAreIndistinguishable() throws Exception {
        testUserFactory.createDoctor("lisa@medexus.com", "Cardiologist");

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "lisa@medexus.com", "password": "wrong"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.detail").value("Incorrect email or password"));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "ghost@medexus.com", "password": "wrong"}
                                """))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_CREDENTIALS"))
                .andExpect(jsonPath("$.detail").value("Incorrect email or password"));
    }

    @Test
    void profileReturnsCurrentUser() throws Exception {
        JsonNode response = signup("""
                {
                  "name": "Dr. Maria Garcia",
                  "email": "maria@medexus.com",
                  "password": "doctor123",
                  "role": "doctor",
                  "specialization": "Neurologist",
                  "bio": "Brain tumours"
                }
                """);

        mockMvc.perform(get("/auth/me")
                        .header("Authorization", bearer(response.path("access_token").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.email").value("maria@medexus.com"))
                .andExpect(jsonPath("$.specialization").value("Neurologist"))
                .andExpect(jsonPath("$.bio").value("Brain tumours"));
    }

    @Test
    void protectedRouteWithoutTokenIsUnauthorized() throws Exception {
        mockMvc.perform(get("/auth/me"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.code").value("unauthorized"));
    }

    @Test
    void tokenOfDeletedUserIsRejected() throws Exception {
        MarketUser doctor = testUserFactory.createDoctor("robert@medexus.com", "General Surgeon");
        String token = testUserFactory.tokenFor(doctor);
        marketUserRepository.deleteById(doctor.getId());

        mockMvc.perform(get("/auth/me").header("Authorization", bearer(token)))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.code").value("USER_NOT_FOUND"));
    }

    @Test
    void tamperedTokenIsRejected() throws Exception {
        String token = testUserFactory.tokenFor(testUserFactory.createDoctor("robert@medexus.com", "General Surgeon"));

        mockMvc.perform(get("/requests")
                        .header("Authorization", bearer(token + "tampered")))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("INVALID_ACCESS_TOKEN"));
    }

    private JsonNode signup(String body) throws Exception {
        MvcResult result = mockMvc.perform(post("/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
