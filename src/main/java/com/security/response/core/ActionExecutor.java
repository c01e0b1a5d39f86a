package com.security.response.core;

import com.security.response.domain.ActionType;
import com.security.response.domain.ExecutionOutcome;

import java.util.Optional;

/**
 * External capability that carries out one {@link ActionType} (EDR isolation, firewall block,
 * IdP account disable). One implementation is registered per action type.
 * <p>
 * Implementations must be idempotent: repeating the action on a target that is already
 * contained reports {@code alreadyInDesiredState} instead of failing.
 */
public interface ActionExecutor {

    ActionType getActionType();

    /**
     * Name used for circuit breakers, logs and the execution result.
     */
    default String getExecutorName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Pre-check against current external state.
     *
     * @return empty when the external system cannot answer, otherwise whether the target
     *         is already in the state the action would produce
     */
    default Optional<Boolean> isInDesiredState(String target) {
        return Optional.empty();
    }

    /**
     * Perform the action. May block on network I/O; the caller bounds it with a timeout and
     * interrupts it on cancellation. Failures may be reported or thrown.
     */
    ExecutionOutcome execute(String target, String reason, double confidence);

    /**
     * Checked before each call; an unhealthy executor fails the proposal without being called.
     */
    default boolean isHealthy() {
        return true;
    }
}
