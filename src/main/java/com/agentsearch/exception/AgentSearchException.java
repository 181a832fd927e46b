package com.agentsearch.exception;

public class AgentSearchException extends RuntimeException {
    
    public AgentSearchException(String message) {
        super(message);
    }
    
    public AgentSearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
