package com.security.response.core;

import com.security.response.api.InsufficientEvidenceException;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ActionType;
import com.security.response.domain.ApprovalDecision;
import com.security.response.domain.ProposalDraft;
import com.security.response.domain.ProposalStatus;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProposalFactoryTest {

    private final ProposalFactory factory = new ProposalFactory();

    @Test
    void createNormalizesDraft() {
        Map<String, String> parameters = new HashMap<>();
        parameters.put("edrTenant", "eu-1");
        parameters.put("ticket", null);
        ProposalDraft draft = ProposalDraft.builder()
                .actionType(ActionType.QUARANTINE_FILE)
                .target("  9f86d081884c7d65  ")
                .confidence(0.78)
                .evidence(Arrays.asList("edr-1", " edr-1 ", "", "edr-2"))
                .reason("known ransomware hash")
                .createdBy("agent-7")
                .parameters(parameters)
                .build();

        ActionProposal p = factory.create(draft, ApprovalDecision.REQUIRE_APPROVAL);

        assertThat(p.getProposalId()).isNotBlank();
        assertThat(p.getTarget()).isEqualTo("9f86d081884c7d65");
        assertThat(p.getEvidence()).containsExactly("edr-1", "edr-2");
        assertThat(p.getTitle()).isEqualTo("Quarantine File: 9f86d081884c7d65");
        assertThat(p.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(p.isRequiresApproval()).isTrue();
        assertThat(p.getParameters()).containsOnlyKeys("edrTenant");
        assertThat(p.getAttachedEvidence()).isEmpty();
        assertThat(p.getCreatedAt()).isNotNull();
    }

    @Test
    void blankEvidenceIsInsufficient() {
        ProposalDraft draft = ProposalDraft.builder()
                .actionType(ActionType.BLOCK_IP)
                .target("203.0.113.9")
                .confidence(0.95)
                .evidence(List.of(" "))
                .reason("c2")
                .createdBy("agent-7")
                .build();

        assertThatThrownBy(() -> factory.create(draft, ApprovalDecision.AUTO_APPROVE))
                .isInstanceOf(InsufficientEvidenceException.class);
    }

    @Test
    void monitorOnlyNeverBuildsAProposal() {
        ProposalDraft draft = ProposalDraft.builder()
                .actionType(ActionType.BLOCK_IP)
                .target("203.0.113.9")
                .confidence(0.10)
                .evidence(List.of("ndr-1"))
                .reason("c2")
                .createdBy("agent-7")
                .build();

        assertThatThrownBy(() -> factory.create(draft, ApprovalDecision.MONITOR_ONLY))
                .isInstanceOf(IllegalStateException.class);
    }
}
