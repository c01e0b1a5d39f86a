package com.security.response.adapters;

import com.security.response.domain.ActionType;
import com.security.response.domain.ExecutionOutcome;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SimulatedActionExecutorTest {

    @Test
    void repeatedActionReportsAlreadyInDesiredState() {
        MockIpBlockExecutor executor = new MockIpBlockExecutor();

        ExecutionOutcome first = executor.execute("203.0.113.9", "c2", 0.9);
        ExecutionOutcome second = executor.execute("203.0.113.9", "c2", 0.9);

        assertThat(executor.getActionType()).isEqualTo(ActionType.BLOCK_IP);
        assertThat(first.isSuccess()).isTrue();
        assertThat(first.isAlreadyInDesiredState()).isFalse();
        assertThat(second.isSuccess()).isTrue();
        assertThat(second.isAlreadyInDesiredState()).isTrue();
        assertThat(executor.isInDesiredState("203.0.113.9")).contains(true);
    }

    @Test
    void releaseUndoesContainment() {
        MockAccountDisableExecutor executor = new MockAccountDisableExecutor();
        executor.execute("JDoe", "impossible travel", 0.8);

        executor.release("jdoe");

        assertThat(executor.isInDesiredState("jdoe")).contains(false);
    }

    @Test
    void protectedTargetIsRefused() {
        MockDomainBlockExecutor executor = new MockDomainBlockExecutor();
        ReflectionTestUtils.setField(executor, "protectedTargets", List.of("corp.example"));

        ExecutionOutcome outcome = executor.execute("CORP.example", "c2", 0.95);

        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.getDetail()).contains("protected");
        assertThat(executor.isInDesiredState("corp.example")).contains(false);
    }
}
