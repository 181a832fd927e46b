package com.agentsearch.exception;

/**
 * A retrieval backend could not be constructed from the supplied settings.
 * Raised once when the backend is built, never while a query is running.
 */
public class BackendConfigurationException extends AgentSearchException {
    
    public BackendConfigurationException(String message) {
        super(message);
    }
}
