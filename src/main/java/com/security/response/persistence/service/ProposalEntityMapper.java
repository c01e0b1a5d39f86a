package com.security.response.persistence.service;

import com.security.response.domain.ActionProposal;
import com.security.response.domain.ExecutionResult;
import com.security.response.persistence.entity.ActionProposalEntity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Converts between {@link ActionProposal} and its entity. Must run inside a transaction:
 * the evidence and parameter collections are lazy.
 */
final class ProposalEntityMapper {

    private ProposalEntityMapper() {
    }

    static ActionProposalEntity toEntity(ActionProposal p) {
        ActionProposalEntity entity = ActionProposalEntity.builder()
                .proposalId(p.getProposalId())
                .actionType(p.getActionType())
                .target(p.getTarget())
                .title(p.getTitle())
                .confidence(p.getConfidence())
                .evidence(new ArrayList<>(p.getEvidence()))
                .attachedEvidence(p.getAttachedEvidence() != null ? new ArrayList<>(p.getAttachedEvidence()) : new ArrayList<>())
                .reason(p.getReason())
                .createdBy(p.getCreatedBy())
                .createdAt(p.getCreatedAt())
                .status(p.getStatus())
                .requiresApproval(p.isRequiresApproval())
                .parameters(p.getParameters() != null ? new LinkedHashMap<>(p.getParameters()) : new LinkedHashMap<>())
                .build();
        applyLifecycle(entity, p);
        return entity;
    }

    /** Copy the fields a transition may change onto a managed entity. */
    static void applyLifecycle(ActionProposalEntity entity, ActionProposal p) {
        entity.setStatus(p.getStatus());
        entity.setDecidedBy(p.getDecidedBy());
        entity.setDecidedAt(p.getDecidedAt());
        entity.setRejectionReason(p.getRejectionReason());
        entity.setSupersededBy(p.getSupersededBy());
        entity.setExecutionStartedAt(p.getExecutionStartedAt());
        ExecutionResult result = p.getResult();
        if (result != null) {
            entity.setResultSuccess(result.isSuccess());
            entity.setResultDetail(result.getDetail());
            entity.setResultError(result.getError());
            entity.setResultAlreadyInDesiredState(result.isAlreadyInDesiredState());
            entity.setResultExecutorName(result.getExecutorName());
            entity.setResultTimestamp(result.getTimestamp());
        }
    }

    static ActionProposal toDomain(ActionProposalEntity e) {
        ExecutionResult result = null;
        if (e.getResultSuccess() != null) {
            result = ExecutionResult.builder()
                    .success(e.getResultSuccess())
                    .detail(e.getResultDetail())
                    .error(e.getResultError())
                    .alreadyInDesiredState(Boolean.TRUE.equals(e.getResultAlreadyInDesiredState()))
                    .executorName(e.getResultExecutorName())
                    .timestamp(e.getResultTimestamp())
                    .build();
        }
        return ActionProposal.builder()
                .proposalId(e.getProposalId())
                .actionType(e.getActionType())
                .target(e.getTarget())
                .title(e.getTitle())
                .confidence(e.getConfidence())
                .evidence(List.copyOf(e.getEvidence()))
                .attachedEvidence(List.copyOf(e.getAttachedEvidence()))
                .reason(e.getReason())
                .createdBy(e.getCreatedBy())
                .createdAt(e.getCreatedAt())
                .status(e.getStatus())
                .requiresApproval(e.isRequiresApproval())
                .parameters(Collections.unmodifiableMap(new LinkedHashMap<>(e.getParameters())))
                .decidedBy(e.getDecidedBy())
                .decidedAt(e.getDecidedAt())
                .rejectionReason(e.getRejectionReason())
                .supersededBy(e.getSupersededBy())
                .executionStartedAt(e.getExecutionStartedAt())
                .result(result)
                .build();
    }
}
