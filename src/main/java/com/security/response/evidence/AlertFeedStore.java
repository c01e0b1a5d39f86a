package com.security.response.evidence;

import com.security.response.domain.AlertSource;
import com.security.response.domain.RawAlert;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.stream.Collectors;

/**
 * In-memory feed of recently ingested alerts, keyed by target. Keeps the last
 * {@value #MAX_PER_TARGET} alerts per target. Backs the built-in evidence sources.
 */
@Component
public class AlertFeedStore {

    static final int MAX_PER_TARGET = 500;

    private final Map<String, ConcurrentLinkedDeque<RawAlert>> byTarget = new ConcurrentHashMap<>();

    public void add(RawAlert alert) {
        if (alert == null || alert.getTarget() == null) {
            throw new IllegalArgumentException("alert and alert.target are required");
        }
        ConcurrentLinkedDeque<RawAlert> recent = byTarget.computeIfAbsent(alert.getTarget().trim(), k -> new ConcurrentLinkedDeque<>());
        recent.addFirst(alert);
        while (recent.size() > MAX_PER_TARGET) recent.removeLast();
    }

    public List<RawAlert> find(String target, AlertSource source) {
        ConcurrentLinkedDeque<RawAlert> recent = target == null ? null : byTarget.get(target.trim());
        if (recent == null) {
            return List.of();
        }
        return recent.stream()
                .filter(a -> a.getSource() == source)
                .collect(Collectors.toList());
    }

    public int size(String target) {
        ConcurrentLinkedDeque<RawAlert> recent = target == null ? null : byTarget.get(target.trim());
        return recent == null ? 0 : recent.size();
    }
}
