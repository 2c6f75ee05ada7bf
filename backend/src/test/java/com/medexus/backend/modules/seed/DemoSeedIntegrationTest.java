package com.medexus.backend.modules.seed;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.medexus.backend.support.AbstractIntegrationTest;
import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MvcResult;

class DemoSeedIntegrationTest extends AbstractIntegrationTest {

    @Test
    void seededAccountsCanLogInAndSeeDemoRequests() throws Exception {
        testUserFactory.createDoctor("leftover@medexus.com", "Cardiologist");

        mockMvc.perform(post("/seed-data"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary.hospitals").value(3))
                .andExpect(jsonPath("$.summary.doctors").value(5))
                .andExpect(jsonPath("$.summary.sample_requests").value(3));

        mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "leftover@medexus.com", "password": "secret123"}
                                """))
                .andExpect(status().isUnauthorized());

        MvcResult login = mockMvc.perform(post("/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"email": "james.wilson@medexus.com", "password": "doctor123"}
                                """))
                .andExpect(status().isOk())
                .andReturn();
        JsonNode body = objectMapper.readTree(login.getResponse().getContentAsString());

        mockMvc.perform(get("/requests").header("Authorization", bearer(body.path("access_token").asText())))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));
    }
}
