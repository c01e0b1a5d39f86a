package com.security.response.adapters;

import com.security.response.domain.ActionType;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Simulated quarantine of a file hash on managed endpoints.
 */
@Component
@ConditionalOnProperty(name = "response.executors.simulated.enabled", havingValue = "true", matchIfMissing = true)
public class MockFileQuarantineExecutor extends SimulatedActionExecutor {

    public MockFileQuarantineExecutor() {
        super(ActionType.QUARANTINE_FILE, "quarantined");
    }
}
