package com.agentsearch.exception;

public class CompletionException extends AgentSearchException {
    
    public CompletionException(String message) {
        super(message);
    }
    
    public CompletionException(String message, Throwable cause) {
        super(message, cause);
    }
}
