package com.security.response.core;

import com.security.response.api.ConfigurationException;
import com.security.response.audit.AuditLog;
import com.security.response.audit.ProposalAuditEntries;
import com.security.response.domain.AuditEntry;
import com.security.response.domain.EngineConfig;
import com.security.response.domain.EngineConfigUpdate;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Holds the live {@link EngineConfig}. Reads are lock-free; updates are validated, audited
 * and then published, so every proposal gated after {@link #update} returns sees the new value.
 * <p>
 * The {@code response.engine.*} properties are only the boot value: the most recent audited
 * change wins on restart.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EngineConfigService {

    private final AuditLog auditLog;

    @Value("${response.engine.auto-approve-threshold:0.90}")
    private double bootAutoApproveThreshold;

    @Value("${response.engine.review-threshold:0.70}")
    private double bootReviewThreshold;

    @Value("${response.engine.force-manual-approval:false}")
    private boolean bootForceManualApproval;

    private volatile EngineConfig current = EngineConfig.defaults();

    @PostConstruct
    void init() {
        EngineConfig boot = EngineConfig.builder()
                .autoApproveThreshold(bootAutoApproveThreshold)
                .reviewThreshold(bootReviewThreshold)
                .forceManualApproval(bootForceManualApproval)
                .build();
        validate(boot);
        Optional<EngineConfig> restored = auditLog.findLatestConfigChange().map(AuditEntry::getConfigAfter);
        current = restored.orElse(boot);
        log.info("Engine config {}: autoApproveThreshold={}, reviewThreshold={}, forceManualApproval={}",
                restored.isPresent() ? "restored from audit log" : "loaded from properties",
                current.getAutoApproveThreshold(), current.getReviewThreshold(), current.isForceManualApproval());
        if (current.isForceManualApproval()) {
            log.warn("force-manual-approval is ON: every proposal will require a human decision");
        }
    }

    public EngineConfig current() {
        return current;
    }

    /**
     * Apply a partial update. Invalid updates are rejected and leave the config unchanged.
     *
     * @throws ConfigurationException thresholds outside [0, 1] or review above auto-approve
     */
    public synchronized EngineConfig update(EngineConfigUpdate update, String actor) {
        if (actor == null || actor.isBlank()) {
            throw new ConfigurationException("actor is required for config changes");
        }
        if (update == null) {
            throw new ConfigurationException("config update is required");
        }
        EngineConfig before = current;
        EngineConfig after = update.applyTo(before);
        validate(after);
        auditLog.append(ProposalAuditEntries.configChange(before, after, actor));
        current = after;
        log.info("Engine config changed by {}: {} -> {}", actor, before, after);
        return after;
    }

    static void validate(EngineConfig config) {
        checkThreshold("autoApproveThreshold", config.getAutoApproveThreshold());
        checkThreshold("reviewThreshold", config.getReviewThreshold());
        if (config.getReviewThreshold() > config.getAutoApproveThreshold()) {
            throw new ConfigurationException(String.format(
                    "reviewThreshold (%s) must not exceed autoApproveThreshold (%s)",
                    config.getReviewThreshold(), config.getAutoApproveThreshold()));
        }
    }

    private static void checkThreshold(String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new ConfigurationException(name + " must be within [0.0, 1.0], was " + value);
        }
    }
}
