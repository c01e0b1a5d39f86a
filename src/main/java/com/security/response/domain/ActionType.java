package com.security.response.domain;

/**
 * Containment actions the engine can propose. Each type is executed by the
 * {@link com.security.response.core.ActionExecutor} registered for it.
 */
public enum ActionType {
    /** Network isolation of an endpoint (EDR containment). */
    ISOLATE_HOST("Isolate Host"),
    /** Block an IP address at the perimeter. */
    BLOCK_IP("Block IP"),
    /** Block a domain (DNS / proxy). */
    BLOCK_DOMAIN("Block Domain"),
    /** Quarantine a file by hash on managed endpoints. */
    QUARANTINE_FILE("Quarantine File"),
    /** Disable a user account in the identity provider. */
    DISABLE_ACCOUNT("Disable Account"),
    /** Anything else; no executor is registered by default. */
    CUSTOM("Custom Action");

    private final String displayName;

    ActionType(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
