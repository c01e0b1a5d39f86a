package com.security.response.adapters;

import com.security.response.domain.ActionType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Simulated account disable in the identity provider.
 */
@Component
@ConditionalOnProperty(name = "response.executors.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class MockAccountDisableExecutor extends SimulatedActionExecutor {

    public MockAccountDisableExecutor() {
        super(ActionType.DISABLE_ACCOUNT, "disabled");
    }
}
