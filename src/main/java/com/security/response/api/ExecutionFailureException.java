package com.security.response.api;

import com.security.response.domain.ActionProposal;

/**
 * External action call failed, timed out or reported failure. Terminal for the proposal:
 * it is recorded as FAILED and never retried automatically. Handler returns HTTP 502.
 */
public class ExecutionFailureException extends ResponseEngineException {

    static final String TIMEOUT_PREFIX = "TimeoutError: ";

    private final String proposalId;
    private final boolean timeout;

    public ExecutionFailureException(String message) {
        this(message, false, null);
    }

    public ExecutionFailureException(String message, boolean timeout, Throwable cause) {
        this(null, message, timeout, cause);
    }

    private ExecutionFailureException(String proposalId, String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.proposalId = proposalId;
        this.timeout = timeout;
    }

    public static ExecutionFailureException timeout(String message, Throwable cause) {
        return new ExecutionFailureException(TIMEOUT_PREFIX + message, true, cause);
    }

    /** Failure of a proposal that has already been recorded as FAILED. */
    public static ExecutionFailureException of(ActionProposal failed) {
        String error = failed.getResult() != null ? failed.getResult().getError() : null;
        String message = error != null ? error : "Execution of proposal " + failed.getProposalId() + " failed";
        return new ExecutionFailureException(failed.getProposalId(), message, message.startsWith(TIMEOUT_PREFIX), null);
    }

    public String getProposalId() {
        return proposalId;
    }

    public boolean isTimeout() {
        return timeout;
    }
}
