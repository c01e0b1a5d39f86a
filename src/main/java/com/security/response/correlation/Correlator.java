package com.security.response.correlation;

import com.security.response.domain.AlertSeverity;
import com.security.response.domain.AlertSource;
import com.security.response.domain.CorrelationFactor;
import com.security.response.domain.CorrelationResult;
import com.security.response.domain.RawAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Turns the alerts gathered for one target into a confidence score.
 * <p>
 * Additive weighted model: each condition in {@link #RULES} adds its weight once when it
 * fires, no matter how many alerts satisfy it. Weights are summed exactly (decimal) and the
 * total is clamped to [0, 1] once, after all rules. Alerts are sorted before evaluation so the
 * result does not depend on arrival order.
 */
@Slf4j
@Component
public class Correlator {

    static final Duration TIME_CORRELATION_WINDOW = Duration.ofMinutes(5);
    static final String SOURCE_UNAVAILABLE_PREFIX = "source_unavailable:";

    static final String MULTI_SOURCE = "multi_source";
    static final String CRITICAL_SEVERITY = "critical_severity";
    static final String LATERAL_MOVEMENT = "lateral_movement";
    static final String MALWARE_FAMILY = "malware_family";
    static final String COMMAND_AND_CONTROL = "command_and_control";
    static final String RANSOMWARE = "ransomware";
    static final String TIME_CORRELATION = "time_correlation";
    static final String GEO_ANOMALY = "geo_anomaly";

    private static final Comparator<RawAlert> ALERT_ORDER = Comparator
            .comparing(RawAlert::getTimestamp, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparingInt(a -> a.getSource() != null ? a.getSource().ordinal() : Integer.MAX_VALUE)
            .thenComparing(RawAlert::getReferenceId, Comparator.nullsLast(Comparator.naturalOrder()));

    /** Rule table, in the order factors are reported. */
    private static final List<CorrelationRule> RULES = List.of(
            CorrelationRule.corroborating(MULTI_SOURCE, "0.20", Correlator::multiSource),
            CorrelationRule.indicator(CRITICAL_SEVERITY, "0.15", a -> a.getSeverity() == AlertSeverity.CRITICAL),
            CorrelationRule.indicator(LATERAL_MOVEMENT, "0.15", tagged(IndicatorTag.LATERAL_MOVEMENT)),
            CorrelationRule.indicator(MALWARE_FAMILY, "0.20", tagged(IndicatorTag.MALWARE_FAMILY)),
            CorrelationRule.indicator(COMMAND_AND_CONTROL, "0.20", tagged(IndicatorTag.COMMAND_AND_CONTROL)),
            CorrelationRule.indicator(RANSOMWARE, "0.25", tagged(IndicatorTag.RANSOMWARE)),
            CorrelationRule.corroborating(TIME_CORRELATION, "0.10", null),
            CorrelationRule.indicator(GEO_ANOMALY, "0.10", tagged(IndicatorTag.GEO_ANOMALY)));

    public CorrelationResult correlate(Collection<RawAlert> alerts) {
        return correlate(alerts, Map.of());
    }

    /**
     * Score the alerts for one target.
     *
     * @param alerts        alerts from every source that answered (may be empty)
     * @param failedSources sources that errored or timed out; reported as zero-weight factors
     */
    public CorrelationResult correlate(Collection<RawAlert> alerts, Map<AlertSource, String> failedSources) {
        Map<AlertSource, String> failures = new EnumMap<>(AlertSource.class);
        if (failedSources != null) {
            failures.putAll(failedSources);
        }
        List<CorrelationFactor> failureFactors = failures.keySet().stream()
                .map(source -> new CorrelationFactor(SOURCE_UNAVAILABLE_PREFIX + source.name().toLowerCase(Locale.ROOT), 0.0))
                .collect(Collectors.toList());

        List<RawAlert> sorted = alerts == null ? List.of() : alerts.stream()
                .filter(Objects::nonNull)
                .sorted(ALERT_ORDER)
                .collect(Collectors.toList());
        if (sorted.isEmpty()) {
            return CorrelationResult.builder()
                    .confidence(0.0)
                    .factors(failureFactors)
                    .evidence(List.of())
                    .alertCount(0)
                    .failedSources(failures)
                    .build();
        }

        Map<String, List<RawAlert>> matches = new LinkedHashMap<>();
        Set<RawAlert> qualifying = new LinkedHashSet<>();
        for (CorrelationRule rule : RULES) {
            if (rule.getMatcher() == null) {
                continue;
            }
            List<RawAlert> contributors = rule.getMatcher().apply(sorted);
            if (!contributors.isEmpty()) {
                matches.put(rule.getName(), contributors);
                if (rule.isIndicator()) {
                    qualifying.addAll(contributors);
                }
            }
        }
        List<RawAlert> windowed = withinWindow(qualifying);
        if (!windowed.isEmpty()) {
            matches.put(TIME_CORRELATION, windowed);
        }

        BigDecimal score = BigDecimal.ZERO;
        List<CorrelationFactor> factors = new ArrayList<>();
        Set<String> evidence = new LinkedHashSet<>();
        for (CorrelationRule rule : RULES) {
            List<RawAlert> contributors = matches.get(rule.getName());
            if (contributors == null) {
                continue;
            }
            score = score.add(rule.getWeight());
            factors.add(new CorrelationFactor(rule.getName(), rule.getWeight().doubleValue()));
            contributors.stream()
                    .map(RawAlert::getReferenceId)
                    .filter(Objects::nonNull)
                    .forEach(evidence::add);
        }
        factors.addAll(failureFactors);

        double confidence = clamp(score);
        log.debug("Correlated {} alert(s): rawScore={} confidence={} factors={} failedSources={}",
                sorted.size(), score, confidence, factors, failures.keySet());

        return CorrelationResult.builder()
                .confidence(confidence)
                .factors(List.copyOf(factors))
                .evidence(List.copyOf(evidence))
                .alertCount(sorted.size())
                .failedSources(failures)
                .build();
    }

    /** The only clamp in the model; applied to the full sum. */
    static double clamp(BigDecimal rawScore) {
        if (rawScore.compareTo(BigDecimal.ONE) > 0) {
            return 1.0;
        }
        if (rawScore.signum() < 0) {
            return 0.0;
        }
        return rawScore.doubleValue();
    }

    private static List<RawAlert> multiSource(List<RawAlert> alerts) {
        long distinctSources = alerts.stream()
                .map(RawAlert::getSource)
                .filter(Objects::nonNull)
                .distinct()
                .count();
        return distinctSources >= 2 ? alerts : List.of();
    }

    /**
     * Alerts that fired an indicator rule, when there are at least two of them and all fall within
     * {@link #TIME_CORRELATION_WINDOW} of each other. Alerts without a timestamp never qualify.
     */
    private static List<RawAlert> withinWindow(Set<RawAlert> qualifying) {
        if (qualifying.size() < 2 || qualifying.stream().anyMatch(a -> a.getTimestamp() == null)) {
            return List.of();
        }
        Instant first = qualifying.stream().map(RawAlert::getTimestamp).min(Comparator.naturalOrder()).orElseThrow();
        Instant last = qualifying.stream().map(RawAlert::getTimestamp).max(Comparator.naturalOrder()).orElseThrow();
        if (Duration.between(first, last).compareTo(TIME_CORRELATION_WINDOW) > 0) {
            return List.of();
        }
        return List.copyOf(qualifying);
    }

    private static Predicate<RawAlert> tagged(IndicatorTag indicator) {
        return alert -> alert.getTechniqueTags() != null
                && alert.getTechniqueTags().stream().anyMatch(indicator::matches);
    }
}
