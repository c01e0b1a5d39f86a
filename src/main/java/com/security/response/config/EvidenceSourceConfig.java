package com.security.response.config;

import com.security.response.domain.AlertSource;
import com.security.response.evidence.AlertFeedEvidenceSource;
import com.security.response.evidence.AlertFeedStore;
import com.security.response.evidence.EvidenceSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Built-in evidence sources answering from the ingested alert feed, one per source family.
 * Disable with {@code response.evidence.feed-sources.enabled=false} when real connectors
 * are registered instead.
 */
@Configuration
@ConditionalOnProperty(name = "response.evidence.feed-sources.enabled", havingValue = "true", matchIfMissing = true)
public class EvidenceSourceConfig {

    @Bean
    public EvidenceSource networkFlowEvidenceSource(AlertFeedStore feedStore) {
        return new AlertFeedEvidenceSource(AlertSource.NETWORK_FLOW, feedStore);
    }

    @Bean
    public EvidenceSource endpointEvidenceSource(AlertFeedStore feedStore) {
        return new AlertFeedEvidenceSource(AlertSource.ENDPOINT, feedStore);
    }

    @Bean
    public EvidenceSource siemEvidenceSource(AlertFeedStore feedStore) {
        return new AlertFeedEvidenceSource(AlertSource.SIEM, feedStore);
    }
}
