package com.security.response.evidence;

import com.security.response.domain.AlertSource;
import com.security.response.domain.RawAlert;

import java.util.List;

/**
 * An external alert source (NDR, EDR, SIEM). Implementations wrap the vendor API and
 * normalize its alerts to {@link RawAlert}.
 * <p>
 * Errors are reported by throwing; the gateway turns them into "no alerts from this source"
 * and never lets them fail the whole correlation.
 */
public interface EvidenceSource {

    AlertSource getSource();

    /**
     * Name used in logs. Defaults to the implementation class.
     */
    default String getSourceName() {
        return this.getClass().getSimpleName();
    }

    /**
     * Alerts currently known for the target. May block on network I/O; the gateway
     * bounds the call with a timeout and interrupts it on cancellation.
     *
     * @param target IP, hostname, username or domain
     * @return alerts (never null)
     */
    List<RawAlert> fetchAlerts(String target);
}
