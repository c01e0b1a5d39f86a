package com.security.response.adapters;

import com.security.response.domain.ActionType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Simulated EDR network containment. Stands in for the endpoint vendor's isolate-host API.
 */
@Component
@ConditionalOnProperty(name = "response.executors.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class MockHostIsolationExecutor extends SimulatedActionExecutor {

    public MockHostIsolationExecutor() {
        super(ActionType.ISOLATE_HOST, "isolated");
    }
}
