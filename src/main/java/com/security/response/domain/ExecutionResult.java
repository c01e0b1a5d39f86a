package com.security.response.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * Outcome recorded on a proposal once it reaches EXECUTED or FAILED.
 */
@Value
@Builder
@Jacksonized
public class ExecutionResult {

    boolean success;
    /** Executor-provided detail (e.g. "Host isolated"). */
    String detail;
    /** Error detail when {@code success} is false; timeouts start with {@code TimeoutError:}. */
    String error;
    /** True when the pre-check found the target already contained. */
    boolean alreadyInDesiredState;
    /** Name of the executor that handled the action, if one was found. */
    String executorName;
    Instant timestamp;

    public static ExecutionResult failure(String error, String executorName) {
        return ExecutionResult.builder()
                .success(false)
                .error(error)
                .executorName(executorName)
                .timestamp(Instant.now())
                .build();
    }
}
