package com.security.response.core;

import com.security.response.api.ExecutionFailureException;
import com.security.response.api.InvalidTransitionException;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ExecutionOutcome;
import com.security.response.domain.ExecutionResult;
import com.security.response.domain.ProposalFilter;
import com.security.response.domain.ProposalStatus;
import com.security.response.messaging.ActionEventProducer;
import com.security.response.registry.ActionRegistry;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeoutException;

/**
 * Runs approved proposals against their {@link ActionExecutor}.
 * <p>
 * The APPROVED to EXECUTING compare-and-set is the concurrency guard: of several workers
 * picking up the same proposal exactly one wins, the others get
 * {@link InvalidTransitionException}. Each external call goes through a per-executor circuit
 * breaker and a time limiter and is never retried; any failure ends the proposal in FAILED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProposalExecutor {

    static final String EXECUTOR_ACTOR = "system:executor";
    static final String WATCHDOG_ACTOR = "system:watchdog";

    private final ActionRegistry registry;
    private final ActionExecutorRegistry executors;
    private final CircuitBreakerRegistry circuitBreakerRegistry;
    private final ActionEventProducer eventProducer;

    @Value("${response.executor.timeout-ms:30000}")
    private long executionTimeoutMs;

    @Value("${response.executor.watchdog.stuck-after-ms:120000}")
    private long stuckAfterMs;

    @Value("${response.executor.pool-size:4}")
    private int poolSize;

    private ExecutorService actionPool;
    private TimeLimiter timeLimiter;

    @PostConstruct
    void init() {
        actionPool = Executors.newFixedThreadPool(Math.max(1, poolSize), r -> {
            Thread t = new Thread(r, "action-executor");
            t.setDaemon(true);
            return t;
        });
        timeLimiter = TimeLimiter.of(TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(executionTimeoutMs))
                .cancelRunningFuture(true)
                .build());
        log.info("ProposalExecutor configuration: timeoutMs={}, stuckAfterMs={}, poolSize={}",
                executionTimeoutMs, stuckAfterMs, poolSize);
    }

    @PreDestroy
    void shutdown() {
        if (actionPool != null) {
            actionPool.shutdownNow();
        }
    }

    /**
     * Execute one approved proposal.
     *
     * @return the proposal in its final state (EXECUTED or FAILED)
     * @throws InvalidTransitionException the proposal is not APPROVED (already claimed, rejected, ...)
     */
    public ActionProposal execute(String proposalId) {
        ActionProposal claimed = registry.transition(proposalId, ProposalStatus.APPROVED, ProposalStatus.EXECUTING,
                EXECUTOR_ACTOR, p -> p.toBuilder().executionStartedAt(Instant.now()).build());
        eventProducer.publishStatus(claimed, EXECUTOR_ACTOR);
        log.info("Executing proposal: proposalId={}, actionType={}, target={}, confidence={}",
                claimed.getProposalId(), claimed.getActionType(), claimed.getTarget(), claimed.getConfidence());

        ExecutionResult result = invoke(claimed);
        ProposalStatus next = result.isSuccess() ? ProposalStatus.EXECUTED : ProposalStatus.FAILED;
        try {
            ActionProposal done = registry.transition(proposalId, ProposalStatus.EXECUTING, next, EXECUTOR_ACTOR,
                    p -> p.toBuilder().result(result).build());
            eventProducer.publishStatus(done, EXECUTOR_ACTOR);
            return done;
        } catch (InvalidTransitionException e) {
            // the watchdog already failed it; its outcome stands
            log.warn("Execution of proposal {} finished as {} after it was moved to {}; outcome not recorded",
                    proposalId, next, e.getActualStatus());
            return registry.findById(proposalId).orElseThrow(() -> e);
        }
    }

    /**
     * Operator-triggered execution of one approved proposal.
     *
     * @return the EXECUTED proposal
     * @throws ExecutionFailureException the action failed or timed out; the proposal is already FAILED
     * @throws InvalidTransitionException the proposal is not APPROVED
     */
    public ActionProposal executeNow(String proposalId) {
        ActionProposal done = execute(proposalId);
        if (done.getStatus() == ProposalStatus.FAILED) {
            throw ExecutionFailureException.of(done);
        }
        return done;
    }

    /**
     * Execute every APPROVED proposal. Proposals claimed concurrently by another worker are skipped.
     *
     * @return number of proposals this call executed
     */
    public int executeApproved() {
        List<ActionProposal> approved = registry.find(ProposalFilter.byStatus(ProposalStatus.APPROVED));
        int executed = 0;
        for (ActionProposal proposal : approved) {
            try {
                execute(proposal.getProposalId());
                executed++;
            } catch (InvalidTransitionException e) {
                log.debug("Proposal {} already claimed: {}", proposal.getProposalId(), e.getMessage());
            }
        }
        return executed;
    }

    /**
     * Fail EXECUTING proposals whose execution started longer than {@code stuck-after-ms} ago,
     * e.g. after a crash mid-call. The external action may still have happened; the error says so.
     *
     * @return number of proposals moved to FAILED
     */
    public int failStuckExecutions() {
        Instant cutoff = Instant.now().minusMillis(stuckAfterMs);
        int failed = 0;
        for (ActionProposal proposal : registry.find(ProposalFilter.byStatus(ProposalStatus.EXECUTING))) {
            Instant started = proposal.getExecutionStartedAt();
            if (started != null && started.isAfter(cutoff)) {
                continue;
            }
            ExecutionFailureException timeout = ExecutionFailureException.timeout(String.format(
                    "execution did not complete within %dms; external state unknown", stuckAfterMs), null);
            try {
                ActionProposal done = registry.transition(proposal.getProposalId(), ProposalStatus.EXECUTING,
                        ProposalStatus.FAILED, WATCHDOG_ACTOR,
                        p -> p.toBuilder().result(ExecutionResult.failure(timeout.getMessage(), null)).build());
                eventProducer.publishStatus(done, WATCHDOG_ACTOR);
                log.error("Watchdog failed stuck proposal: proposalId={}, target={}, startedAt={}",
                        done.getProposalId(), done.getTarget(), started);
                failed++;
            } catch (InvalidTransitionException e) {
                log.debug("Proposal {} finished before the watchdog: {}", proposal.getProposalId(), e.getMessage());
            }
        }
        return failed;
    }

    private ExecutionResult invoke(ActionProposal proposal) {
        Optional<ActionExecutor> executorOpt = executors.find(proposal.getActionType());
        if (executorOpt.isEmpty()) {
            return failed(new ExecutionFailureException(
                    "No executor registered for action type " + proposal.getActionType()), proposal, null);
        }
        ActionExecutor executor = executorOpt.get();
        String name = executor.getExecutorName();
        if (!executor.isHealthy()) {
            return failed(new ExecutionFailureException(name + " is unhealthy; call not attempted"), proposal, name);
        }
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(name);
        Callable<ExecutionOutcome> guarded = CircuitBreaker.decorateCallable(cb,
                TimeLimiter.decorateFutureSupplier(timeLimiter, () -> actionPool.submit(() -> perform(executor, proposal))));

        try {
            ExecutionOutcome outcome = guarded.call();
            if (outcome == null) {
                return failed(new ExecutionFailureException(name + " returned no outcome"), proposal, name);
            }
            if (!outcome.isSuccess()) {
                return failed(new ExecutionFailureException(name + " reported failure: " + outcome.getDetail()), proposal, name);
            }
            log.info("Proposal executed: proposalId={}, target={}, executor={}, alreadyInDesiredState={}",
                    proposal.getProposalId(), proposal.getTarget(), name, outcome.isAlreadyInDesiredState());
            return ExecutionResult.builder()
                    .success(true)
                    .detail(outcome.getDetail())
                    .alreadyInDesiredState(outcome.isAlreadyInDesiredState())
                    .executorName(name)
                    .timestamp(Instant.now())
                    .build();
        } catch (TimeoutException e) {
            return failed(ExecutionFailureException.timeout(
                    name + " did not respond within " + executionTimeoutMs + "ms", e), proposal, name);
        } catch (CallNotPermittedException e) {
            return failed(new ExecutionFailureException("Circuit open for executor " + name + "; call not attempted",
                    false, e), proposal, name);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return failed(new ExecutionFailureException(name + " failed: " + describe(cause), false, cause), proposal, name);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failed(new ExecutionFailureException(name + " interrupted", false, e), proposal, name);
        } catch (Exception e) {
            return failed(new ExecutionFailureException(name + " failed: " + describe(e), false, e), proposal, name);
        }
    }

    /** Pre-check first; an already-contained target counts as success without a second call. */
    private static ExecutionOutcome perform(ActionExecutor executor, ActionProposal proposal) {
        Optional<Boolean> inDesiredState = Optional.empty();
        try {
            inDesiredState = executor.isInDesiredState(proposal.getTarget());
        } catch (RuntimeException e) {
            log.warn("Pre-check failed for executor={} target={}; executing anyway: {}",
                    executor.getExecutorName(), proposal.getTarget(), e.getMessage());
        }
        if (inDesiredState.orElse(false)) {
            return ExecutionOutcome.alreadyInDesiredState(
                    proposal.getActionType().getDisplayName() + " already in effect for " + proposal.getTarget());
        }
        return executor.execute(proposal.getTarget(), proposal.getReason(), proposal.getConfidence());
    }

    private static ExecutionResult failed(ExecutionFailureException failure, ActionProposal proposal, String executorName) {
        log.error("Execution {}: proposalId={}, actionType={}, target={}, executor={}, error={}",
                failure.isTimeout() ? "timed out" : "failed",
                proposal.getProposalId(), proposal.getActionType(), proposal.getTarget(), executorName,
                failure.getMessage(), failure.getCause());
        return ExecutionResult.failure(failure.getMessage(), executorName);
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return t.getClass().getSimpleName() + (message != null && !message.isBlank() ? ": " + message : "");
    }
}
