package com.rivaflow.backend.modules.wearable;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import javax.crypto.SecretKey;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rivaflow.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableWorkoutRepository;
import com.rivaflow.backend.support.AbstractPostgresIntegrationTest;
import com.rivaflow.backend.support.TestAccessTokens;

import io.jsonwebtoken.security.Keys;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class SessionWearableFlowIntegrationTest extends AbstractPostgresIntegrationTest {

    private static final List<String> ALL_SCOPES = List.of("read:workout", "read:recovery", "read:sleep",
            "read:cycles", "read:body_measurement", "read:profile", "offline");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    @Autowired
    private WearableWorkoutRepository workoutRepository;

    private UUID ownerId;
    private String bearer;
    private LocalDate yesterday;

    @BeforeEach
    void setUp() {
        ownerId = UUID.randomUUID();
        bearer = "Bearer " + TestAccessTokens.issue(jwtTokenProvider.getSecretKey(), ownerId);
        yesterday = LocalDate.now(ZoneOffset.UTC).minusDays(1);
    }

    @Test
    @DisplayName("requests without a token are unauthorized")
    void requiresToken() throws Exception {
        mockMvc.perform(get("/sessions"))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer"))
                .andExpect(jsonPath("$.code").value("authentication_required"));
    }

    @Test
    @DisplayName("a token signed with another key is rejected as invalid")
    void rejectsForeignToken() throws Exception {
        SecretKey foreignKey = Keys.hmacShaKeyFor("another-secret-another-secret-0123456789".getBytes(StandardCharsets.UTF_8));

        mockMvc.perform(get("/sessions")
                        .header("Authorization", "Bearer " + TestAccessTokens.issue(foreignKey, ownerId)))
                .andExpect(status().isUnauthorized())
                .andExpect(header().string("WWW-Authenticate", "Bearer error=\"invalid_token\""))
                .andExpect(jsonPath("$.code").value("invalid_token"));
    }

    @Test
    @DisplayName("an invalid session comes back as 422 with field errors")
    void invalidSessionRejected() throws Exception {
        Map<String, Object> body = Map.of(
                "sessionDate", yesterday.plusDays(5).toString(),
                "classType", "gi",
                "gymName", "",
                "durationMinutes", 0,
                "intensity", 3
        );

        mockMvc.perform(post("/sessions")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.errors[?(@.field == 'gymName')]").exists())
                .andExpect(jsonPath("$.errors[?(@.field == 'sessionDate')]").exists());
    }

    @Test
    @DisplayName("detailed session round trip keeps rolls and derived totals")
    void detailedSessionRoundTrip() throws Exception {
        Map<String, Object> body = Map.of(
                "sessionDate", yesterday.toString(),
                "classTime", "18:00",
                "classType", "no-gi",
                "gymName", "Riverside BJJ",
                "durationMinutes", 90,
                "intensity", 4,
                "mode", "DETAILED",
                "rolls", List.of(
                        Map.of("partnerName", "Ana", "durationMinutes", 6, "submissionsFor", List.of(19)),
                        Map.of("partnerName", "Marcus", "submissionsAgainst", List.of(34, 35))
                ),
                "techniques", List.of(Map.of("movementId", 20, "movementName", "Triangle Choke"), Map.of())
        );

        JsonNode created = createSession(body);
        String id = created.path("id").asText();

        mockMvc.perform(get("/sessions/" + id).header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rollCount").value(2))
                .andExpect(jsonPath("$.submissionsFor").value(1))
                .andExpect(jsonPath("$.submissionsAgainst").value(2))
                .andExpect(jsonPath("$.rolls[1].rollNumber").value(2))
                .andExpect(jsonPath("$.rolls[1].durationMinutes").value(5))
                .andExpect(jsonPath("$.techniques.length()").value(1));
    }

    @Test
    @DisplayName("sync auto-applies a lone close workout and a second session cannot take it")
    void syncAndExclusiveMatch() throws Exception {
        mockMvc.perform(put("/wearable/connection")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("grantedScopes", ALL_SCOPES))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.needsReauthorization").value(false));

        String start = yesterday + "T17:55:00Z";
        String end = yesterday + "T19:30:00Z";
        mockMvc.perform(post("/wearable/workouts")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("workouts", List.of(Map.of(
                                "externalId", "whoop-1",
                                "startTime", start,
                                "endTime", end,
                                "sportName", "jiu jitsu",
                                "strain", 14.26,
                                "kilojoules", 2092.0,
                                "avgHeartRate", 142,
                                "maxHeartRate", 181,
                                "zoneDurations", Map.of("zone1", 20, "zone2", 40)
                        ))))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.created").value(1));

        String sessionId = createSession(eveningSession()).path("id").asText();

        MvcResult syncResult = mockMvc.perform(post("/wearable/sessions/" + sessionId + "/sync")
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("AUTO_APPLIED"))
                .andExpect(jsonPath("$.session.needsReview").value(true))
                .andExpect(jsonPath("$.session.wearable.strain").value(14.3))
                .andExpect(jsonPath("$.session.wearable.calories").value(500))
                .andReturn();
        String workoutId = objectMapper.readTree(syncResult.getResponse().getContentAsString())
                .path("session").path("wearableWorkoutId").asText();

        String otherSessionId = createSession(eveningSession()).path("id").asText();
        mockMvc.perform(post("/wearable/sessions/" + otherSessionId + "/match")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("workoutId", workoutId))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("WORKOUT_ALREADY_MATCHED"));

        mockMvc.perform(get("/wearable/zones")
                        .param("sessionIds", sessionId, otherSessionId)
                        .header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.zones['" + sessionId + "'].zone2").value(40))
                .andExpect(jsonPath("$.zones['" + otherSessionId + "']").doesNotExist());

        mockMvc.perform(post("/sessions/" + sessionId + "/review/ack").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.needsReview").value(false));

        mockMvc.perform(delete("/sessions/" + sessionId).header("Authorization", bearer))
                .andExpect(status().isNoContent());
        assertThat(workoutRepository.findById(UUID.fromString(workoutId)))
                .hasValueSatisfying(workout -> assertThat(workout.getLinkedSessionId()).isNull());

        mockMvc.perform(post("/wearable/sessions/" + otherSessionId + "/match")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("workoutId", workoutId))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.wearableWorkoutId").value(workoutId))
                .andExpect(jsonPath("$.needsReview").value(false));
    }

    @Test
    @DisplayName("sync without the required scopes asks for reauthorization")
    void syncWithoutScopes() throws Exception {
        String sessionId = createSession(eveningSession()).path("id").asText();

        mockMvc.perform(post("/wearable/sessions/" + sessionId + "/sync").header("Authorization", bearer))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("REAUTHORIZATION_REQUIRED"))
                .andExpect(jsonPath("$.missingScopes.length()").value(ALL_SCOPES.size()));
    }

    @Test
    @DisplayName("workouts with readings a session cannot hold are refused at ingest")
    void ingestRejectsOutOfRangeReadings() throws Exception {
        mockMvc.perform(post("/wearable/workouts")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("workouts", List.of(Map.of(
                                "externalId", "whoop-hot",
                                "startTime", yesterday + "T18:00:00Z",
                                "endTime", yesterday + "T19:30:00Z",
                                "strain", 23.4,
                                "avgHeartRate", 260
                        ))))))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.errors[?(@.field == 'workouts[0].strain')]").exists())
                .andExpect(jsonPath("$.errors[?(@.field == 'workouts[0].avgHeartRate')]").exists());
    }

    @Test
    @DisplayName("sessions of another user are not visible")
    void ownerIsolation() throws Exception {
        String sessionId = createSession(eveningSession()).path("id").asText();
        String strangerBearer = "Bearer " + TestAccessTokens.issue(jwtTokenProvider.getSecretKey(), UUID.randomUUID());

        mockMvc.perform(get("/sessions/" + sessionId).header("Authorization", strangerBearer))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("SESSION_NOT_FOUND"));
    }

    private Map<String, Object> eveningSession() {
        return Map.of(
                "sessionDate", yesterday.toString(),
                "classTime", "18:00",
                "classType", "gi",
                "gymName", "Riverside BJJ",
                "durationMinutes", 90,
                "intensity", 4,
                "rollCount", 5
        );
    }

    private JsonNode createSession(Map<String, Object> body) throws Exception {
        MvcResult result = mockMvc.perform(post("/sessions")
                        .header("Authorization", bearer)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isCreated())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
