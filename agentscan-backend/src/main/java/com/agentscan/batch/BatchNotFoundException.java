package com.agentscan.batch;

/**
 * Thrown when a batch id does not resolve to a known batch.
 */
public class BatchNotFoundException extends RuntimeException {
    /**
     * Create a new exception.
     *
     * @param message error message
     */
    public BatchNotFoundException(String message) {
        super(message);
    }
}
