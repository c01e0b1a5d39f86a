package com.security.response.core;

import com.security.response.domain.ActionType;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the {@link ActionExecutor} for an action type.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ActionExecutorRegistry {

    private final List<ActionExecutor> executors;

    private final Map<ActionType, ActionExecutor> executorByType = new EnumMap<>(ActionType.class);

    @PostConstruct
    void init() {
        for (ActionExecutor executor : executors) {
            ActionExecutor previous = executorByType.putIfAbsent(executor.getActionType(), executor);
            if (previous != null) {
                log.warn("Ignoring executor {} for {}: {} is already registered",
                        executor.getExecutorName(), executor.getActionType(), previous.getExecutorName());
            }
        }
        log.info("Registered action executors: {}", executorByType.keySet());
        if (executorByType.isEmpty()) {
            log.warn("No action executors registered; approved proposals will fail at execution");
        }
    }

    public Optional<ActionExecutor> find(ActionType actionType) {
        return Optional.ofNullable(executorByType.get(actionType));
    }
}
