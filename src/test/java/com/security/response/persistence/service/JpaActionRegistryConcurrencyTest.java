package com.security.response.persistence.service;

import com.security.response.AutonomousResponseApplication;
import com.security.response.api.DuplicateTargetException;
import com.security.response.api.InvalidTransitionException;
import com.security.response.core.ProposalService;
import com.security.response.domain.ActionProposal;
import com.security.response.domain.ActionType;
import com.security.response.domain.ProposalDraft;
import com.security.response.domain.ProposalFilter;
import com.security.response.domain.ProposalStatus;
import com.security.response.domain.ResponseDecision;
import com.security.response.messaging.ActionEventProducer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Races against the database-backed registry through {@link ProposalService}. Runs without a
 * wrapping test transaction so every registry call commits on its own, as in the service.
 */
@SpringBootTest(classes = AutonomousResponseApplication.class)
@DirtiesContext
@TestPropertySource(properties = {
        "spring.datasource.url=jdbc:h2:mem:response-races;DB_CLOSE_DELAY=-1;MODE=PostgreSQL",
        "response.registry.store=jpa",
        "response.kafka.consumer.enabled=false",
        "response.executor.scheduling.enabled=false"
})
class JpaActionRegistryConcurrencyTest {

    private static final int THREADS = 8;

    @Autowired
    private ProposalService proposalService;

    @Autowired
    private JpaActionRegistry registry;

    @MockitoBean
    private ActionEventProducer eventProducer;

    private static String uniqueTarget() {
        return "10.30." + UUID.randomUUID();
    }

    private static ProposalDraft draft(String target, double confidence, String evidence) {
        return ProposalDraft.builder()
                .actionType(ActionType.ISOLATE_HOST)
                .target(target)
                .confidence(confidence)
                .evidence(List.of(evidence))
                .reason("correlated alerts")
                .createdBy("correlator")
                .build();
    }

    /** Runs the tasks together and returns how each ended: "OK" or the exception's simple name. */
    private static Map<String, Integer> race(List<Callable<?>> tasks) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(tasks.size());
        CountDownLatch start = new CountDownLatch(1);
        Map<String, Integer> outcomes = new ConcurrentHashMap<>();
        List<Future<?>> futures = new ArrayList<>();
        for (Callable<?> task : tasks) {
            futures.add(pool.submit(() -> {
                start.await();
                String outcome;
                try {
                    task.call();
                    outcome = "OK";
                } catch (Exception e) {
                    outcome = e.getClass().getSimpleName();
                }
                outcomes.merge(outcome, 1, Integer::sum);
                return null;
            }));
        }
        start.countDown();
        for (Future<?> f : futures) {
            f.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();
        return outcomes;
    }

    private List<ActionProposal> proposalsFor(String target) {
        return registry.find(ProposalFilter.builder().target(target).build());
    }

    @Test
    void concurrentFirstSubmissionsCreateOneProposal() throws Exception {
        String target = uniqueTarget();
        List<Callable<?>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            ProposalDraft d = draft(target, 0.80, "ndr-" + i);
            tasks.add(() -> proposalService.submit(d));
        }

        Map<String, Integer> outcomes = race(tasks);

        assertThat(outcomes).containsExactlyInAnyOrderEntriesOf(Map.of(
                "OK", 1,
                DuplicateTargetException.class.getSimpleName(), THREADS - 1));
        List<ActionProposal> stored = proposalsFor(target);
        assertThat(stored).hasSize(1);
        ActionProposal active = registry.findActiveByTarget(target).orElseThrow();
        assertThat(active.getStatus()).isEqualTo(ProposalStatus.PENDING);
        assertThat(active.getAttachedEvidence()).hasSize(THREADS - 1);
    }

    @Test
    void concurrentApprovalsHaveExactlyOneWinner() throws Exception {
        String target = uniqueTarget();
        ActionProposal pending = proposalService.submit(draft(target, 0.80, "edr-1")).getProposal();
        List<Callable<?>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String actor = "analyst-" + i;
            tasks.add(() -> proposalService.approve(pending.getProposalId(), actor));
        }

        Map<String, Integer> outcomes = race(tasks);

        assertThat(outcomes).containsExactlyInAnyOrderEntriesOf(Map.of(
                "OK", 1,
                InvalidTransitionException.class.getSimpleName(), THREADS - 1));
        ActionProposal approved = proposalService.get(pending.getProposalId());
        assertThat(approved.getStatus()).isEqualTo(ProposalStatus.APPROVED);
        assertThat(approved.getDecidedBy()).startsWith("analyst-");
        assertThat(proposalService.auditTrail(pending.getProposalId())).hasSize(2);
    }

    @Test
    void approveRacingRejectResolvesToOneDecision() throws Exception {
        String target = uniqueTarget();
        ActionProposal pending = proposalService.submit(draft(target, 0.80, "siem-1")).getProposal();
        AtomicInteger approvals = new AtomicInteger();
        AtomicInteger rejections = new AtomicInteger();
        List<Callable<?>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            String actor = "analyst-" + i;
            if (i % 2 == 0) {
                tasks.add(() -> {
                    proposalService.approve(pending.getProposalId(), actor);
                    return approvals.incrementAndGet();
                });
            } else {
                tasks.add(() -> {
                    proposalService.reject(pending.getProposalId(), actor, "benign scanner");
                    return rejections.incrementAndGet();
                });
            }
        }

        Map<String, Integer> outcomes = race(tasks);

        assertThat(outcomes.get("OK")).isEqualTo(1);
        assertThat(approvals.get() + rejections.get()).isEqualTo(1);
        ActionProposal decided = proposalService.get(pending.getProposalId());
        assertThat(decided.getStatus())
                .isEqualTo(approvals.get() == 1 ? ProposalStatus.APPROVED : ProposalStatus.REJECTED);
        if (decided.getStatus() == ProposalStatus.REJECTED) {
            assertThat(registry.findActiveByTarget(target)).isEmpty();
        }
    }

    @Test
    void concurrentHigherConfidenceSubmissionsLeaveTheMostConfidentActive() throws Exception {
        String target = uniqueTarget();
        ActionProposal incumbent = proposalService.submit(draft(target, 0.72, "ndr-0")).getProposal();
        List<Callable<?>> tasks = new ArrayList<>();
        for (int i = 0; i < THREADS; i++) {
            ProposalDraft d = draft(target, 0.75 + i * 0.02, "edr-" + i);
            tasks.add(() -> {
                ResponseDecision decision = proposalService.submit(d);
                assertThat(decision.getOutcome()).isEqualTo(ResponseDecision.Outcome.SUPERSEDED);
                return decision;
            });
        }

        Map<String, Integer> outcomes = race(tasks);

        assertThat(outcomes.keySet()).isSubsetOf("OK", DuplicateTargetException.class.getSimpleName());
        assertThat(outcomes.values().stream().mapToInt(Integer::intValue).sum()).isEqualTo(THREADS);
        assertThat(outcomes.get("OK")).isGreaterThanOrEqualTo(1);

        List<ActionProposal> stored = proposalsFor(target);
        assertThat(stored.stream().filter(ActionProposal::isActive)).hasSize(1);
        ActionProposal active = registry.findActiveByTarget(target).orElseThrow();
        assertThat(active.getConfidence()).isEqualTo(0.75 + (THREADS - 1) * 0.02);
        assertThat(stored).filteredOn(p -> !p.getProposalId().equals(active.getProposalId()))
                .allSatisfy(p -> {
                    assertThat(p.getStatus()).isEqualTo(ProposalStatus.REJECTED);
                    assertThat(p.getSupersededBy()).isNotNull();
                    assertThat(p.getDecidedBy()).isEqualTo("system:supersede");
                });
        assertThat(proposalService.get(incumbent.getProposalId()).getStatus()).isEqualTo(ProposalStatus.REJECTED);
    }
}
