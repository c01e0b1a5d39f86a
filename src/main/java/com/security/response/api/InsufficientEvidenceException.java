package com.security.response.api;

/**
 * No usable evidence for the target: no proposal is created and the caller should keep monitoring.
 * Handler returns HTTP 422.
 */
public class InsufficientEvidenceException extends ResponseEngineException {

    private final String target;

    public InsufficientEvidenceException(String target, String message) {
        super(message);
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
