package com.security.response.api;

/**
 * Malformed engine config update; rejected before being applied. Handler returns HTTP 400.
 */
public class ConfigurationException extends ResponseEngineException {

    public ConfigurationException(String message) {
        super(message);
    }
}
