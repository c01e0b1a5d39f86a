package com.security.response.api;

import com.security.response.core.ProposalExecutor;
import com.security.response.core.ProposalService;
import com.security.response.core.ResponseOrchestrator;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ActionType;
import com.security.response.domain.ProposalDraft;
import com.security.response.domain.ProposalFilter;
import com.security.response.domain.ProposalStats;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.ResponseDecision;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Operator API for action proposals: review queue, approve/reject, and the two creation paths
 * (external submission and correlate-and-propose).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/proposals")
@RequiredArgsConstructor
@Tag(name = "Proposals", description = "Confidence-gated containment proposals and human approval")
public class ProposalController {

    private final ProposalService proposalService;
    private final ResponseOrchestrator orchestrator;
    private final ProposalExecutor proposalExecutor;

    @GetMapping
    @Operation(summary = "List proposals", description = "Newest first; all filters optional")
    public ResponseEntity<List<ActionProposal>> list(
            @RequestParam(required = false) ProposalStatus status,
            @RequestParam(required = false) String target,
            @RequestParam(required = false) ActionType actionType,
            @RequestParam(required = false) Boolean requiresApproval) {
        ProposalFilter filter = ProposalFilter.builder()
                .status(status)
                .target(target)
                .actionType(actionType)
                .requiresApproval(requiresApproval)
                .build();
        return ResponseEntity.ok(proposalService.list(filter));
    }

    @GetMapping("/stats")
    @Operation(summary = "Proposal statistics", description = "Counts per status and action type")
    public ResponseEntity<ProposalStats> stats() {
        return ResponseEntity.ok(proposalService.stats());
    }

    @GetMapping("/pending/count")
    @Operation(summary = "Pending proposal count")
    public ResponseEntity<Map<String, Long>> pendingCount() {
        return ResponseEntity.ok(Map.of("pending", proposalService.pendingCount()));
    }

    @GetMapping("/{proposalId}")
    @Operation(summary = "Get proposal")
    public ResponseEntity<ActionProposal> get(@PathVariable String proposalId) {
        return ResponseEntity.ok(proposalService.get(proposalId));
    }

    @PostMapping
    @Operation(summary = "Submit proposal",
            description = "External producers submit a scored proposal; it goes through the same approval gate. "
                    + "Returns 201 when a proposal was stored, 200 for monitor-only, 409 when the target already has one.")
    public ResponseEntity<ResponseDecision> submit(@Valid @RequestBody ProposalSubmitRequestDto dto) {
        ProposalDraft draft = ProposalDraft.builder()
                .actionType(dto.getActionType())
                .target(dto.getTarget())
                .confidence(dto.getConfidence())
                .evidence(dto.getEvidence())
                .reason(dto.getReason())
                .createdBy(dto.getCreatedBy())
                .title(dto.getTitle())
                .parameters(dto.getParameters())
                .build();
        return toResponse(proposalService.submit(draft));
    }

    @PostMapping("/correlate")
    @Operation(summary = "Correlate and propose",
            description = "Gathers alerts for the target from every source, scores them and creates a proposal if warranted")
    public ResponseEntity<ResponseDecision> correlate(@Valid @RequestBody CorrelateRequestDto dto) {
        Duration deadline = dto.getDeadlineMs() != null ? Duration.ofMillis(dto.getDeadlineMs()) : null;
        return toResponse(orchestrator.correlateAndPropose(dto.getTarget(), dto.getActionType(), dto.getCreatedBy(), deadline));
    }

    @PostMapping("/{proposalId}/approve")
    @Operation(summary = "Approve pending proposal", description = "409 if the proposal is no longer pending")
    public ResponseEntity<ActionProposal> approve(@PathVariable String proposalId,
                                                  @Valid @RequestBody ApproveRequestDto dto) {
        return ResponseEntity.ok(proposalService.approve(proposalId, dto.getActor()));
    }

    @PostMapping("/{proposalId}/reject")
    @Operation(summary = "Reject pending proposal", description = "409 if the proposal is no longer pending")
    public ResponseEntity<ActionProposal> reject(@PathVariable String proposalId,
                                                 @Valid @RequestBody RejectRequestDto dto) {
        return ResponseEntity.ok(proposalService.reject(proposalId, dto.getActor(), dto.getReason()));
    }

    @PostMapping("/{proposalId}/execute")
    @Operation(summary = "Execute approved proposal now",
            description = "Runs the action without waiting for the dispatcher. 409 if not approved, 502 if the action failed")
    public ResponseEntity<ActionProposal> execute(@PathVariable String proposalId) {
        return ResponseEntity.ok(proposalExecutor.executeNow(proposalId));
    }

    private static ResponseEntity<ResponseDecision> toResponse(ResponseDecision decision) {
        HttpStatus status = decision.getOutcome() == ResponseDecision.Outcome.MONITOR_ONLY ? HttpStatus.OK : HttpStatus.CREATED;
        return ResponseEntity.status(status).body(decision);
    }
}
