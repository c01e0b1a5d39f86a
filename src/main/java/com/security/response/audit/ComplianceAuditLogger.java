package com.security.response.audit;

import com.security.response.domain.AuditEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Mirrors audit entries to the application log as {@code [AUDIT]} lines so they reach the
 * log pipeline (SIEM, retention) as well as the audit store.
 */
@Slf4j
@Component
public class ComplianceAuditLogger {

    public void log(AuditEntry entry) {
        switch (entry.getEventType()) {
            case CONFIG_CHANGE:
                log.info("[AUDIT] CONFIG_CHANGE seq={} actor={} before={} after={}",
                        entry.getSequence(), entry.getActor(), entry.getConfigBefore(), entry.getConfigAfter());
                break;
            case EVIDENCE_ATTACHED:
                log.info("[AUDIT] EVIDENCE_ATTACHED seq={} proposalId={} target={} actor={} detail={}",
                        entry.getSequence(), entry.getProposalId(), entry.getTarget(), entry.getActor(), entry.getDetail());
                break;
            default:
                log.info("[AUDIT] {} seq={} proposalId={} target={} actionType={} {}->{} actor={} detail={}",
                        entry.getEventType(), entry.getSequence(), entry.getProposalId(), entry.getTarget(),
                        entry.getActionType(), entry.getFromStatus(), entry.getToStatus(), entry.getActor(),
                        entry.getDetail());
        }
    }
}
