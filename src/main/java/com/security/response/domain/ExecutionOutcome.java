package com.security.response.domain;

import lombok.Builder;
import lombok.Value;

/**
 * What an external action executor reported.
 */
@Value
@Builder
public class ExecutionOutcome {

    boolean success;
    String detail;
    /** Target was already contained; treated as success. */
    boolean alreadyInDesiredState;

    public static ExecutionOutcome succeeded(String detail) {
        return ExecutionOutcome.builder().success(true).detail(detail).build();
    }

    public static ExecutionOutcome alreadyInDesiredState(String detail) {
        return ExecutionOutcome.builder().success(true).detail(detail).alreadyInDesiredState(true).build();
    }

    public static ExecutionOutcome failed(String detail) {
        return ExecutionOutcome.builder().success(false).detail(detail).build();
    }
}
