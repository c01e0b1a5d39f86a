package com.security.response.adapters;

import com.security.response.domain.ActionType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Simulated perimeter firewall block of an IP address.
 */
@Component
@ConditionalOnProperty(name = "response.executors.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class MockIpBlockExecutor extends SimulatedActionExecutor {

    public MockIpBlockExecutor() {
        super(ActionType.BLOCK_IP, "blocked");
    }
}
