package com.rivaflow.backend.modules;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rivaflow.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.rivaflow.backend.support.AbstractPostgresIntegrationTest;
import com.rivaflow.backend.support.TestAccessTokens;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
class ReferenceDataIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    private String bearer;

    @BeforeEach
    void setUp() {
        bearer = "Bearer " + TestAccessTokens.issue(jwtTokenProvider.getSecretKey(), UUID.randomUUID());
    }

    @Test
    @DisplayName("glossary search ranks name prefixes first and finds aliases")
    void glossarySearch() throws Exception {
        mockMvc.perform(get("/glossary/movements").param("q", "triangle").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Triangle Choke"));

        mockMvc.perform(get("/glossary/movements")
                        .param("q", "mata")
                        .param("submissionsOnly", "true")
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value(19));
    }

    @Test
    @DisplayName("unknown movement is a 404 problem")
    void unknownMovement() throws Exception {
        mockMvc.perform(get("/glossary/movements/999999").header("Authorization", bearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("MOVEMENT_NOT_FOUND"));
    }

    @Test
    @DisplayName("manual contacts show up in partner search with a contact id")
    void contactSearch() throws Exception {
        mockMvc.perform(post("/contacts")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "name", "Ana Souza",
                                "contactType", "TRAINING_PARTNER",
                                "beltRank", "purple"
                        ))))
                .andExpect(status().isCreated());

        mockMvc.perform(get("/partners/search").param("q", "  ANA ").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1))
                .andExpect(jsonPath("$[0].id").value(startsWith("c-")))
                .andExpect(jsonPath("$[0].source").value("manual"));
    }
}
