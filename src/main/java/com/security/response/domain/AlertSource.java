package com.security.response.domain;

/**
 * Families of alert sources queried by the evidence gateway.
 */
public enum AlertSource {
    /** Network-flow analytics (e.g. NDR, flow-based detections). */
    NETWORK_FLOW,
    /** Endpoint / EDR detections. */
    ENDPOINT,
    /** SIEM query results. */
    SIEM
}
