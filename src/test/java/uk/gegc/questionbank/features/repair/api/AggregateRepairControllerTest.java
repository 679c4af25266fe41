package uk.gegc.questionbank.features.repair.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.security.test.context.support.WithMockUser;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.questionbank.features.repair.api.dto.RepairStatusDto;
import uk.gegc.questionbank.features.repair.application.ConsistencyRepairWorkflow;
import uk.gegc.questionbank.features.repair.domain.model.RepairState;
import uk.gegc.questionbank.features.repair.domain.model.RepairTarget;
import uk.gegc.questionbank.shared.exception.ResourceNotFoundException;
import uk.gegc.questionbank.shared.exception.ValidationException;
import uk.gegc.questionbank.testsupport.WebMvcSecurityTestConfig;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AggregateRepairController.class)
@Import(WebMvcSecurityTestConfig.class)
@DisplayName("AggregateRepairController")
class AggregateRepairControllerTest {

    private static final UUID RUN_ID = UUID.fromString("30000000-0000-0000-0000-000000000003");
    private static final Instant STARTED = Instant.parse("2025-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ConsistencyRepairWorkflow repairWorkflow;

    @Test
    @DisplayName("POST /repairs: admin starts a run and gets 202")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void start_admin_returns202() throws Exception {
        when(repairWorkflow.startRepair(RepairTarget.QUESTIONS)).thenReturn(runStatus(RepairState.CLEARING, true));

        mockMvc.perform(post("/api/v1/admin/aggregates/repairs").param("target", "QUESTIONS"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.id").value(RUN_ID.toString()))
                .andExpect(jsonPath("$.state").value("CLEARING"))
                .andExpect(jsonPath("$.active").value(true));
    }

    @Test
    @DisplayName("POST /repairs: a run already in progress maps to 409")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void start_inProgress_returns409() throws Exception {
        when(repairWorkflow.startRepair(RepairTarget.ALL))
                .thenThrow(new IllegalStateException("A repair run is already in progress"));

        mockMvc.perform(post("/api/v1/admin/aggregates/repairs"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.detail").value("A repair run is already in progress"));
    }

    @Test
    @DisplayName("POST /repairs: non-admin users are forbidden")
    @WithMockUser(username = "bob")
    void start_nonAdmin_returns403() throws Exception {
        mockMvc.perform(post("/api/v1/admin/aggregates/repairs"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(repairWorkflow);
    }

    @Test
    @DisplayName("POST /repairs: anonymous callers are unauthorized")
    void start_anonymous_returns401() throws Exception {
        mockMvc.perform(post("/api/v1/admin/aggregates/repairs"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    @DisplayName("POST /repairs/users/{userId}: admin starts a run for one user")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void startUser_admin_returns202() throws Exception {
        RepairStatusDto status = new RepairStatusDto(RUN_ID, RepairTarget.USER, "alice", RepairState.CLEARING,
                true, false, null, null, null, null, 0, 0, Map.of(), 0, List.of(), null, STARTED, STARTED, null);
        when(repairWorkflow.startUserRepair("alice")).thenReturn(status);

        mockMvc.perform(post("/api/v1/admin/aggregates/repairs/users/{userId}", "alice"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.target").value("USER"))
                .andExpect(jsonPath("$.userId").value("alice"));
    }

    @Test
    @DisplayName("POST /repairs/users/{userId}: non-admin users are forbidden")
    @WithMockUser(username = "alice")
    void startUser_nonAdmin_returns403() throws Exception {
        mockMvc.perform(post("/api/v1/admin/aggregates/repairs/users/{userId}", "alice"))
                .andExpect(status().isForbidden());

        verifyNoInteractions(repairWorkflow);
    }

    @Test
    @DisplayName("POST /repairs?target=USER: a user run without a user maps to 400")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void start_userTargetWithoutUser_returns400() throws Exception {
        when(repairWorkflow.startRepair(RepairTarget.USER))
                .thenThrow(new ValidationException("Target USER needs a user id"));

        mockMvc.perform(post("/api/v1/admin/aggregates/repairs").param("target", "USER"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("GET /repairs/{id}: returns run status")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void get_returnsStatus() throws Exception {
        when(repairWorkflow.getRepairStatus(RUN_ID)).thenReturn(runStatus(RepairState.DONE, false));

        mockMvc.perform(get("/api/v1/admin/aggregates/repairs/{runId}", RUN_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("DONE"))
                .andExpect(jsonPath("$.rowsProcessed").value(1000));
    }

    @Test
    @DisplayName("GET /repairs/{id}: unknown run maps to 404")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void get_unknown_returns404() throws Exception {
        when(repairWorkflow.getRepairStatus(RUN_ID)).thenThrow(new ResourceNotFoundException("Repair run " + RUN_ID + " not found"));

        mockMvc.perform(get("/api/v1/admin/aggregates/repairs/{runId}", RUN_ID))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("GET /repairs: lists recent runs")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void list_returnsRuns() throws Exception {
        when(repairWorkflow.listRecentRuns()).thenReturn(List.of(runStatus(RepairState.FAILED, false)));

        mockMvc.perform(get("/api/v1/admin/aggregates/repairs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].state").value("FAILED"));
    }

    @Test
    @DisplayName("POST /repairs/{id}/cancel and /resume delegate to the workflow")
    @WithMockUser(username = "admin", roles = "ADMIN")
    void cancelAndResume() throws Exception {
        when(repairWorkflow.cancelRepair(RUN_ID)).thenReturn(runStatus(RepairState.REBUILDING, true));
        when(repairWorkflow.resumeRepair(RUN_ID)).thenReturn(runStatus(RepairState.REBUILDING, true));

        mockMvc.perform(post("/api/v1/admin/aggregates/repairs/{runId}/cancel", RUN_ID))
                .andExpect(status().isOk());
        mockMvc.perform(post("/api/v1/admin/aggregates/repairs/{runId}/resume", RUN_ID))
                .andExpect(status().isAccepted());
    }

    private static RepairStatusDto runStatus(RepairState state, boolean active) {
        return new RepairStatusDto(RUN_ID, RepairTarget.ALL, null, state, active, false,
                null, null, null, null, 10, 1000, Map.of(), 0, List.of(), null,
                STARTED, STARTED, null);
    }
}
