package com.security.response.adapters;

import com.security.response.domain.ActionType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Simulated DNS / proxy domain block.
 */
@Component
@ConditionalOnProperty(name = "response.executors.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class MockDomainBlockExecutor extends SimulatedActionExecutor {

    public MockDomainBlockExecutor() {
        super(ActionType.BLOCK_DOMAIN, "blocked");
    }
}
