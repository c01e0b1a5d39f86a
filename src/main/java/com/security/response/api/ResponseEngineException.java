package com.security.response.api;

/**
 * Base for all errors the engine surfaces to callers. Unchecked: callers decide
 * whether to retry against the now-current state.
 */
public class ResponseEngineException extends RuntimeException {

    public ResponseEngineException(String message) {
        super(message);
    }

    public ResponseEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
