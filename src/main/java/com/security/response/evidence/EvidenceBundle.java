package com.security.response.evidence;

import com.security.response.domain.AlertSource;
import com.security.response.domain.RawAlert;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Alerts gathered for one target across all sources, plus the sources that failed.
 */
@Value
public class EvidenceBundle {

    String target;
    List<RawAlert> alerts;
    Map<AlertSource, String> failedSources;

    public boolean isEmpty() {
        return alerts.isEmpty();
    }
}
