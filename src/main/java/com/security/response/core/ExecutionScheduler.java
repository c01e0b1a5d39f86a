package com.security.response.core;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background dispatcher for approved proposals and watchdog for stuck executions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "response.executor.scheduling.enabled", havingValue = "true", matchIfMissing = true)
public class ExecutionScheduler {

    private final ProposalExecutor proposalExecutor;

    @Scheduled(fixedDelayString = "${response.executor.poll-interval-ms:2000}")
    public void dispatchApproved() {
        try {
            int executed = proposalExecutor.executeApproved();
            if (executed > 0) {
                log.info("Dispatcher executed {} approved proposal(s)", executed);
            }
        } catch (Exception e) {
            log.error("Dispatcher run failed", e);
        }
    }

    @Scheduled(fixedDelayString = "${response.executor.watchdog.poll-interval-ms:30000}")
    public void failStuckExecutions() {
        try {
            int failed = proposalExecutor.failStuckExecutions();
            if (failed > 0) {
                log.warn("Watchdog failed {} stuck execution(s)", failed);
            }
        } catch (Exception e) {
            log.error("Watchdog run failed", e);
        }
    }
}
