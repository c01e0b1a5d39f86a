package com.security.response.adapters;

import com.security.response.core.ActionExecutor;
import com.security.response.domain.ActionType;
import com.security.response.domain.ExecutionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Base for the simulated executors. Remembers the targets it has acted on so the pre-check
 * reports them as already contained, and refuses targets listed in
 * {@code response.executors.simulated.protected-targets} to exercise the failure path.
 */
@Slf4j
public abstract class SimulatedActionExecutor implements ActionExecutor {

    private final ActionType actionType;
    private final String pastTense;
    private final Set<String> contained = ConcurrentHashMap.newKeySet();
    private volatile boolean healthy = true;

    @Value("${response.executors.simulated.protected-targets:}")
    private List<String> protectedTargets = List.of();

    @Value("${response.executors.simulated.latency-ms:0}")
    private long latencyMs;

    protected SimulatedActionExecutor(ActionType actionType, String pastTense) {
        this.actionType = actionType;
        this.pastTense = pastTense;
    }

    @Override
    public ActionType getActionType() {
        return actionType;
    }

    @Override
    public Optional<Boolean> isInDesiredState(String target) {
        return Optional.of(contained.contains(normalize(target)));
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    /** Simulate an outage of the external system. */
    public void setHealthy(boolean healthy) {
        this.healthy = healthy;
    }

    @Override
    public ExecutionOutcome execute(String target, String reason, double confidence) {
        log.debug("{} executing target={} confidence={}", getExecutorName(), target, confidence);
        simulateLatency();
        if (protectedTargets.stream().anyMatch(p -> normalize(p).equals(normalize(target)))) {
            return ExecutionOutcome.failed("Target " + target + " is protected; refused by " + getExecutorName());
        }
        if (!contained.add(normalize(target))) {
            return ExecutionOutcome.alreadyInDesiredState(target + " already " + pastTense);
        }
        return ExecutionOutcome.succeeded(target + " " + pastTense);
    }

    /** Undo, for tests and demos. */
    public void release(String target) {
        contained.remove(normalize(target));
    }

    private void simulateLatency() {
        if (latencyMs <= 0) {
            return;
        }
        try {
            Thread.sleep(latencyMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(getExecutorName() + " interrupted", e);
        }
    }

    private static String normalize(String target) {
        return target == null ? "" : target.trim().toLowerCase(Locale.ROOT);
    }
}
