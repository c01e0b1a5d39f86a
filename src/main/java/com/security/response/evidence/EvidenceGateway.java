package com.security.response.evidence;

import com.security.response.domain.AlertSource;
import com.security.response.domain.RawAlert;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Uniform query facade over the configured alert sources. Sources are queried in parallel;
 * a source that errors or misses its timeout contributes no alerts and is reported back as a
 * failed source. A fetch never returns partial data from a cancelled source.
 */
@Slf4j
@Service
public class EvidenceGateway {

    private final List<EvidenceSource> sources;
    private final ExecutorService fetchPool;

    @Value("${response.evidence.source-timeout-ms:5000}")
    private long sourceTimeoutMs;

    @Value("${response.evidence.default-deadline-ms:10000}")
    private long defaultDeadlineMs;

    public EvidenceGateway(List<EvidenceSource> sources) {
        this.sources = List.copyOf(sources);
        this.fetchPool = Executors.newFixedThreadPool(Math.max(2, sources.size() * 2), r -> {
            Thread t = new Thread(r, "evidence-fetch");
            t.setDaemon(true);
            return t;
        });
        log.info("EvidenceGateway initialized with {} source(s): {}", sources.size(),
                sources.stream().map(s -> s.getSource() + "/" + s.getSourceName()).toList());
    }

    /**
     * Gather alerts for the target from every source, within the default deadline.
     */
    public EvidenceBundle gather(String target) {
        return gather(target, Duration.ofMillis(defaultDeadlineMs));
    }

    /**
     * Gather alerts for the target from every source. Each source gets
     * {@code min(source timeout, time left before deadline)}.
     *
     * @param deadline overall budget for the whole gather; null means the default deadline
     */
    public EvidenceBundle gather(String target, Duration deadline) {
        Duration budget = deadline != null ? deadline : Duration.ofMillis(defaultDeadlineMs);
        long deadlineNanos = System.nanoTime() + budget.toNanos();

        Map<EvidenceSource, Future<List<RawAlert>>> pending = new LinkedHashMap<>();
        for (EvidenceSource source : sources) {
            pending.put(source, fetchPool.submit(() -> source.fetchAlerts(target)));
        }

        List<RawAlert> alerts = new ArrayList<>();
        Map<AlertSource, String> failed = new EnumMap<>(AlertSource.class);
        for (Map.Entry<EvidenceSource, Future<List<RawAlert>>> entry : pending.entrySet()) {
            EvidenceSource source = entry.getKey();
            Future<List<RawAlert>> future = entry.getValue();
            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadlineNanos - System.nanoTime());
            long waitMs = Math.max(0L, Math.min(sourceTimeoutMs, remainingMs));
            try {
                List<RawAlert> fetched = future.get(waitMs, TimeUnit.MILLISECONDS);
                if (fetched != null) {
                    alerts.addAll(fetched);
                }
                log.debug("Source {} returned {} alert(s) for target={}", source.getSourceName(),
                        fetched != null ? fetched.size() : 0, target);
            } catch (TimeoutException e) {
                future.cancel(true);
                log.warn("Evidence source {} timed out after {}ms for target={}; treating as no alerts",
                        source.getSourceName(), waitMs, target);
                failed.merge(source.getSource(), "TimeoutError: no response within " + waitMs + "ms", (a, b) -> a + "; " + b);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Evidence source {} failed for target={}; treating as no alerts: {}",
                        source.getSourceName(), target, cause.getMessage());
                failed.merge(source.getSource(), describe(cause), (a, b) -> a + "; " + b);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.values().forEach(f -> f.cancel(true));
                log.warn("Evidence gathering interrupted for target={}", target);
                failed.merge(source.getSource(), "interrupted", (a, b) -> a + "; " + b);
                break;
            }
        }
        return new EvidenceBundle(target, List.copyOf(alerts), failed);
    }

    /**
     * Query a single source family. Errors propagate to the caller.
     */
    public List<RawAlert> fetch(String target, AlertSource source) {
        List<RawAlert> alerts = new ArrayList<>();
        for (EvidenceSource candidate : sources) {
            if (candidate.getSource() == source) {
                alerts.addAll(candidate.fetchAlerts(target));
            }
        }
        return alerts;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return t.getClass().getSimpleName() + (message != null && !message.isBlank() ? ": " + message : "");
    }

    @PreDestroy
    void shutdown() {
        fetchPool.shutdownNow();
    }
}
