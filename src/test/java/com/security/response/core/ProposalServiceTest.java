package com.security.response.core;

import com.security.response.api.DuplicateTargetException;
import com.security.response.api.InsufficientEvidenceException;
import com.security.response.api.InvalidTransitionException;
import com.security.response.api.ProposalNotFoundException;
import com.security.response.audit.ComplianceAuditLogger;
import com.security.response.audit.InMemoryAuditLog;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ActionType;
import com.security.response.domain.AuditEntry;
import com.security.response.domain.AuditEventType;
import com.security.response.domain.EngineConfigUpdate;
import com.security.response.domain.ProposalDraft;
import com.security.response.domain.ProposalStats;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.RegistrationResult;
import com.security.response.domain.ResponseDecision;
import com.security.response.messaging.ActionEventProducer;
import com.security.response.registry.ActionRegistry;
import com.security.response.registry.InMemoryActionRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for ProposalService against the in-memory registry: gating, merge policy,
 * human decisions and live config changes.
 */
@ExtendWith(MockitoExtension.class)
class ProposalServiceTest {

    @Mock
    private ActionEventProducer eventProducer;

    private InMemoryAuditLog auditLog;
    private InMemoryActionRegistry registry;
    private EngineConfigService configService;
    private ProposalService service;

    @BeforeEach
    void setUp() {
        auditLog = new InMemoryAuditLog(new ComplianceAuditLogger());
        registry = new InMemoryActionRegistry(auditLog);
        configService = new EngineConfigService(auditLog);
        ReflectionTestUtils.setField(configService, "bootAutoApproveThreshold", 0.90);
        ReflectionTestUtils.setField(configService, "bootReviewThreshold", 0.70);
        ReflectionTestUtils.setField(configService, "bootForceManualApproval", false);
        configService.init();
        service = new ProposalService(registry, new ApprovalGate(), new ProposalFactory(), configService,
                auditLog, eventProducer);
    }

    private static ProposalDraft draft(String target, double confidence, String... evidence) {
        return ProposalDraft.builder()
                .actionType(ActionType.ISOLATE_HOST)
                .target(target)
                .confidence(confidence)
                .evidence(List.of(evidence))
                .reason("EDR ransomware detection on " + target)
                .createdBy("agent-7")
                .build();
    }

    @Test
    void autoApprovesAtThreshold() {
        ResponseDecision decision = service.submit(draft("host-a", 0.90, "edr-1"));

        assertThat(decision.getOutcome()).isEqualTo(ResponseDecision.Outcome.CREATED);
        ActionProposal p = decision.getProposal();
        assertThat(p.getStatus()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(p.isRequiresApproval()).isFalse();
        assertThat(p.getTitle()).isEqualTo("Isolate Host: host-a");
        assertThat(decision.getMessage()).isEqualTo("Proposal auto-approved");
        verify(eventProducer).publishCreated(p);
    }

    @Test
    void justBelowAutoThresholdWaitsForHuman() {
        ResponseDecision decision = service.submit(draft("host-a", 0.89999, "edr-1"));

        assertThat(decision.getProposal().getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(decision.getProposal().isRequiresApproval()).isTrue();
        assertThat(service.pendingCount()).isEqualTo(1);
    }

    @Test
    void belowReviewThresholdCreatesNothing() {
        ResponseDecision decision = service.submit(draft("host-a", 0.45, "siem-1"));

        assertThat(decision.getOutcome()).isEqualTo(ResponseDecision.Outcome.MONITOR_ONLY);
        assertThat(decision.getProposal()).isNull();
        assertThat(decision.getMessage()).isEqualTo("Confidence 0.45 below review threshold 0.70 for host-a; monitor only");
        assertThat(registry.findActiveByTarget("host-a")).isEmpty();
        assertThat(auditLog.findAll()).isEmpty();
        verify(eventProducer, never()).publishCreated(any());
    }

    @Test
    void lowConfidenceWithoutEvidenceIsStillMonitorOnly() {
        ResponseDecision decision = service.submit(draft("host-a", 0.0));

        assertThat(decision.getOutcome()).isEqualTo(ResponseDecision.Outcome.MONITOR_ONLY);
    }

    @Test
    void proposalWithoutEvidenceIsRejected() {
        assertThatThrownBy(() -> service.submit(draft("host-a", 0.95)))
                .isInstanceOf(InsufficientEvidenceException.class);
        assertThat(registry.findActiveByTarget("host-a")).isEmpty();
    }

    @Test
    void confidenceOutsideUnitIntervalIsRejected() {
        assertThatThrownBy(() -> service.submit(draft("host-a", 1.2, "e1")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.submit(draft("host-a", Double.NaN, "e1")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void forceManualHoldsEvenFullConfidence() {
        configService.update(EngineConfigUpdate.builder().forceManualApproval(true).build(), "soc-lead");

        ActionProposal p = service.submit(draft("host-a", 1.0, "edr-1")).getProposal();

        assertThat(p.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(p.isRequiresApproval()).isTrue();
    }

    @Test
    void configChangeAppliesToNextProposalOnly() {
        ActionProposal before = service.submit(draft("host-a", 0.95, "edr-1")).getProposal();

        configService.update(EngineConfigUpdate.builder().forceManualApproval(true).build(), "soc-lead");
        ActionProposal after = service.submit(draft("host-b", 0.95, "edr-2")).getProposal();

        assertThat(before.getStatus()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(registry.findById(before.getProposalId()).orElseThrow().isRequiresApproval()).isFalse();
        assertThat(after.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(after.isRequiresApproval()).isTrue();
        assertThat(auditLog.findAll()).extracting(AuditEntry::getEventType)
                .containsExactly(AuditEventType.PROPOSAL_CREATED, AuditEventType.CONFIG_CHANGE,
                        AuditEventType.PROPOSAL_CREATED);
    }

    @Test
    void duplicateForActiveTargetAttachesEvidenceAndFails() {
        ActionProposal first = service.submit(draft("host-a", 0.92, "edr-1")).getProposal();

        assertThatThrownBy(() -> service.submit(draft("host-a", 0.80, "edr-1", "ndr-4")))
                .isInstanceOf(DuplicateTargetException.class)
                .satisfies(e -> assertThat(((DuplicateTargetException) e).getExistingProposalId())
                        .isEqualTo(first.getProposalId()));

        ActionProposal stored = service.get(first.getProposalId());
        assertThat(stored.getAttachedEvidence()).containsExactly("ndr-4");
        assertThat(stored.getConfidence()).isEqualTo(0.92);
        verify(eventProducer).publishEvidenceAttached(any(), eq("agent-7"));
    }

    @Test
    void higherConfidenceReplacesPendingProposal() {
        ActionProposal first = service.submit(draft("host-a", 0.75, "siem-1")).getProposal();

        ResponseDecision second = service.submit(draft("host-a", 0.85, "siem-1", "edr-2"));

        assertThat(second.getOutcome()).isEqualTo(ResponseDecision.Outcome.SUPERSEDED);
        assertThat(second.getSupersededProposalId()).isEqualTo(first.getProposalId());
        assertThat(service.get(first.getProposalId()).getStatus()).isEqualTo(ProposalStatus.REJECTED);
        assertThat(service.pendingCount()).isEqualTo(1);
    }

    @Test
    void approveRecordsDecision() {
        ActionProposal p = service.submit(draft("host-a", 0.80, "edr-1")).getProposal();

        ActionProposal approved = service.approve(p.getProposalId(), "alice");

        assertThat(approved.getStatus()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(approved.getDecidedBy()).isEqualTo("alice");
        assertThat(approved.getDecidedAt()).isNotNull();
        assertThat(service.auditTrail(p.getProposalId())).extracting(AuditEntry::getActor)
                .containsExactly("agent-7", "alice");
    }

    @Test
    void rejectRequiresReasonAndIsTerminal() {
        ActionProposal p = service.submit(draft("host-a", 0.80, "edr-1")).getProposal();

        assertThatThrownBy(() -> service.reject(p.getProposalId(), "alice", " "))
                .isInstanceOf(IllegalArgumentException.class);
        ActionProposal rejected = service.reject(p.getProposalId(), "alice", "known admin tool");

        assertThat(rejected.getRejectionReason()).isEqualTo("known admin tool");
        assertThatThrownBy(() -> service.approve(p.getProposalId(), "bob"))
                .isInstanceOf(InvalidTransitionException.class);
        assertThat(service.get(p.getProposalId()).getStatus()).isEqualTo(ProposalStatus.REJECTED);
    }

    @Test
    void doubleApproveFails() {
        ActionProposal p = service.submit(draft("host-a", 0.80, "edr-1")).getProposal();
        service.approve(p.getProposalId(), "alice");

        assertThatThrownBy(() -> service.approve(p.getProposalId(), "bob"))
                .isInstanceOf(InvalidTransitionException.class);
    }

    @Test
    void approveRequiresActor() {
        ActionProposal p = service.submit(draft("host-a", 0.80, "edr-1")).getProposal();

        assertThatThrownBy(() -> service.approve(p.getProposalId(), ""))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownProposalIsNotFound() {
        assertThatThrownBy(() -> service.get("nope")).isInstanceOf(ProposalNotFoundException.class);
    }

    @Test
    void statsCountEveryStatus() {
        service.submit(draft("host-a", 0.95, "e1"));
        service.submit(draft("host-b", 0.80, "e2"));
        ActionProposal c = service.submit(draft("host-c", 0.80, "e3")).getProposal();
        service.reject(c.getProposalId(), "alice", "benign");

        ProposalStats stats = service.stats();

        assertThat(stats.getTotal()).isEqualTo(3);
        assertThat(stats.getByStatus()).containsEntry(ProposalStatus.APPROVED, 1L)
                .containsEntry(ProposalStatus.PENDING, 1L)
                .containsEntry(ProposalStatus.REJECTED, 1L)
                .containsEntry(ProposalStatus.EXECUTED, 0L);
        assertThat(stats.getByActionType()).containsEntry(ActionType.ISOLATE_HOST, 3L);
        assertThat(stats.getRequiresApproval()).isEqualTo(2);
    }

    @Test
    void losingAConcurrentFirstRegistrationRetriesAgainstTheWinner() {
        ActionRegistry racing = mock(ActionRegistry.class);
        ActionProposal winner = ActionProposal.builder()
                .proposalId("winner")
                .actionType(ActionType.ISOLATE_HOST)
                .target("host-a")
                .confidence(0.90)
                .evidence(List.of("edr-1"))
                .attachedEvidence(List.of("ndr-2"))
                .status(ProposalStatus.APPROVED)
                .build();
        when(racing.register(any()))
                .thenThrow(new DataIntegrityViolationException("duplicate key on active_targets"))
                .thenReturn(RegistrationResult.duplicate(winner));
        ProposalService racingService = new ProposalService(racing, new ApprovalGate(), new ProposalFactory(),
                configService, auditLog, eventProducer);

        assertThatThrownBy(() -> racingService.submit(draft("host-a", 0.80, "ndr-2")))
                .isInstanceOf(DuplicateTargetException.class);
        verify(racing, times(2)).register(any());
    }
}
