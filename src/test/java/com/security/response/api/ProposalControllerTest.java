package com.security.response.api;

import com.security.response.core.ProposalExecutor;
import com.security.response.core.ProposalService;
import com.security.response.core.ResponseOrchestrator;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ActionType;
import com.security.response.domain.ExecutionResult;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.ResponseDecision;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Unit tests for ProposalController using MockMvc.
 */
@WebMvcTest(controllers = ProposalController.class)
class ProposalControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ProposalService proposalService;

    @MockitoBean
    private ResponseOrchestrator orchestrator;

    @MockitoBean
    private ProposalExecutor proposalExecutor;

    private static ActionProposal proposal(ProposalStatus status) {
        return ActionProposal.builder()
                .proposalId("p-1")
                .actionType(ActionType.ISOLATE_HOST)
                .target("10.0.0.5")
                .title("Isolate Host: 10.0.0.5")
                .confidence(0.85)
                .evidence(List.of("ndr-1", "edr-7"))
                .attachedEvidence(List.of())
                .reason("Correlated 2 alert(s)")
                .createdBy("agent-7")
                .createdAt(Instant.parse("2026-03-01T10:02:00Z"))
                .status(status)
                .requiresApproval(true)
                .parameters(Map.of())
                .build();
    }

    @Test
    void submitReturnsCreatedWithPendingProposal() throws Exception {
        ActionProposal p = proposal(ProposalStatus.PENDING);
        when(proposalService.submit(any())).thenReturn(ResponseDecision.builder()
                .outcome(ResponseDecision.Outcome.CREATED)
                .target(p.getTarget())
                .proposal(p)
                .message("Proposal awaiting human approval")
                .build());

        mockMvc.perform(post("/api/v1/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "actionType": "ISOLATE_HOST",
                                  "target": "10.0.0.5",
                                  "confidence": 0.85,
                                  "evidence": ["ndr-1", "edr-7"],
                                  "reason": "lateral movement followed by ransomware",
                                  "createdBy": "agent-7"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.outcome").value("CREATED"))
                .andExpect(jsonPath("$.proposal.proposalId").value("p-1"))
                .andExpect(jsonPath("$.proposal.status").value("PENDING"))
                .andExpect(jsonPath("$.proposal.requiresApproval").value(true))
                .andExpect(jsonPath("$.proposal.evidence[1]").value("edr-7"));
    }

    @Test
    void submitMonitorOnlyReturnsOk() throws Exception {
        when(proposalService.submit(any())).thenReturn(ResponseDecision.builder()
                .outcome(ResponseDecision.Outcome.MONITOR_ONLY)
                .target("10.0.0.5")
                .message("Confidence 0.40 below review threshold 0.70 for 10.0.0.5; monitor only")
                .build());

        mockMvc.perform(post("/api/v1/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "actionType": "BLOCK_IP",
                                  "target": "10.0.0.5",
                                  "confidence": 0.40,
                                  "evidence": ["siem-1"],
                                  "reason": "single low alert",
                                  "createdBy": "agent-7"
                                }
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.outcome").value("MONITOR_ONLY"))
                .andExpect(jsonPath("$.proposal").doesNotExist());
    }

    @Test
    void submitWithEmptyEvidenceFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "actionType": "ISOLATE_HOST",
                                  "target": "10.0.0.5",
                                  "confidence": 0.95,
                                  "evidence": [],
                                  "reason": "no references",
                                  "createdBy": "agent-7"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("VALIDATION_FAILED"))
                .andExpect(jsonPath("$.details.evidence").exists());
        verifyNoInteractions(proposalService);
    }

    @Test
    void submitWithConfidenceAboveOneFailsValidation() throws Exception {
        mockMvc.perform(post("/api/v1/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "actionType": "ISOLATE_HOST",
                                  "target": "10.0.0.5",
                                  "confidence": 1.5,
                                  "evidence": ["e1"],
                                  "reason": "r",
                                  "createdBy": "agent-7"
                                }
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.confidence").exists());
    }

    @Test
    void duplicateTargetReturnsConflict() throws Exception {
        when(proposalService.submit(any())).thenThrow(new DuplicateTargetException("10.0.0.5", "p-1"));

        mockMvc.perform(post("/api/v1/proposals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "actionType": "ISOLATE_HOST",
                                  "target": "10.0.0.5",
                                  "confidence": 0.80,
                                  "evidence": ["edr-9"],
                                  "reason": "repeat detection",
                                  "createdBy": "agent-7"
                                }
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("DUPLICATE_TARGET"))
                .andExpect(jsonPath("$.existingProposalId").value("p-1"));
    }

    @Test
    void correlateWithoutAlertsReturnsUnprocessable() throws Exception {
        when(orchestrator.correlateAndPropose(eq("10.0.0.9"), eq(ActionType.ISOLATE_HOST), eq("soc"), isNull()))
                .thenThrow(new InsufficientEvidenceException("10.0.0.9", "No alerts found for 10.0.0.9; monitor only"));

        mockMvc.perform(post("/api/v1/proposals/correlate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"target": "10.0.0.9", "actionType": "ISOLATE_HOST", "createdBy": "soc"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("INSUFFICIENT_EVIDENCE"))
                .andExpect(jsonPath("$.target").value("10.0.0.9"));
    }

    @Test
    void approveReturnsApprovedProposal() throws Exception {
        when(proposalService.approve("p-1", "alice")).thenReturn(proposal(ProposalStatus.APPROVED).toBuilder()
                .decidedBy("alice").build());

        mockMvc.perform(post("/api/v1/proposals/p-1/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\": \"alice\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("APPROVED"))
                .andExpect(jsonPath("$.decidedBy").value("alice"));
    }

    @Test
    void approveAfterRejectReturnsConflict() throws Exception {
        when(proposalService.approve("p-1", "bob")).thenThrow(new InvalidTransitionException(
                "p-1", ProposalStatus.REJECTED, ProposalStatus.PENDING, ProposalStatus.APPROVED));

        mockMvc.perform(post("/api/v1/proposals/p-1/approve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\": \"bob\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("INVALID_TRANSITION"))
                .andExpect(jsonPath("$.currentStatus").value("REJECTED"))
                .andExpect(jsonPath("$.requestedStatus").value("APPROVED"));
    }

    @Test
    void executeReturnsExecutedProposal() throws Exception {
        when(proposalExecutor.executeNow("p-1")).thenReturn(proposal(ProposalStatus.EXECUTED).toBuilder()
                .result(ExecutionResult.builder().success(true).detail("10.0.0.5 isolated")
                        .executorName("MockHostIsolationExecutor").timestamp(Instant.now()).build())
                .build());

        mockMvc.perform(post("/api/v1/proposals/p-1/execute"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("EXECUTED"))
                .andExpect(jsonPath("$.result.detail").value("10.0.0.5 isolated"));
    }

    @Test
    void executeTimeoutReturnsBadGateway() throws Exception {
        ActionProposal failed = proposal(ProposalStatus.FAILED).toBuilder()
                .result(ExecutionResult.failure("TimeoutError: EdrIsolationExecutor did not respond within 30000ms",
                        "EdrIsolationExecutor"))
                .build();
        when(proposalExecutor.executeNow("p-1")).thenThrow(ExecutionFailureException.of(failed));

        mockMvc.perform(post("/api/v1/proposals/p-1/execute"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("EXECUTION_TIMEOUT"))
                .andExpect(jsonPath("$.proposalId").value("p-1"))
                .andExpect(jsonPath("$.timeout").value(true))
                .andExpect(jsonPath("$.message").value("TimeoutError: EdrIsolationExecutor did not respond within 30000ms"));
    }

    @Test
    void rejectRequiresReason() throws Exception {
        mockMvc.perform(post("/api/v1/proposals/p-1/reject")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"actor\": \"alice\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.reason").value("reason is required"));
    }

    @Test
    void unknownProposalReturnsNotFound() throws Exception {
        when(proposalService.get("nope")).thenThrow(new ProposalNotFoundException("nope"));

        mockMvc.perform(get("/api/v1/proposals/nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("NOT_FOUND"));
    }

    @Test
    void listPassesFilters() throws Exception {
        when(proposalService.list(any())).thenReturn(List.of(proposal(ProposalStatus.PENDING)));

        mockMvc.perform(get("/api/v1/proposals").param("status", "PENDING").param("target", "10.0.0.5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].proposalId").value("p-1"));

        verify(proposalService).list(argThat(f ->
                f.getStatus() == ProposalStatus.PENDING && "10.0.0.5".equals(f.getTarget())));
    }

    @Test
    void pendingCountReturnsNumber() throws Exception {
        when(proposalService.pendingCount()).thenReturn(3L);

        mockMvc.perform(get("/api/v1/proposals/pending/count"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.pending").value(3));
    }
}
