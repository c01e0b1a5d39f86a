package com.security.response.evidence;

import com.security.response.domain.AlertSource;
import com.security.response.domain.RawAlert;

import java.util.List;

/**
 * Evidence source answering from the {@link AlertFeedStore} for one source family.
 * Stands in for a vendor connector when alerts are pushed (Kafka / REST) rather than pulled.
 */
public class AlertFeedEvidenceSource implements EvidenceSource {

    private final AlertSource source;
    private final AlertFeedStore feedStore;

    public AlertFeedEvidenceSource(AlertSource source, AlertFeedStore feedStore) {
        this.source = source;
        this.feedStore = feedStore;
    }

    @Override
    public AlertSource getSource() {
        return source;
    }

    @Override
    public String getSourceName() {
        return "AlertFeed[" + source + "]";
    }

    @Override
    public List<RawAlert> fetchAlerts(String target) {
        return feedStore.find(target, source);
    }
}
