package com.cropadvisor.common.exception;

/**
 * A collaborator (weather provider, temperature history, context store) could not supply
 * the data an evaluator needs. Recoverable: the evaluator's outcome becomes unavailable.
 */
public class DataUnavailableException extends AdvisoryException {

    public DataUnavailableException(String component, String message) {
        super(component, message);
    }

    public DataUnavailableException(String component, String message, Throwable cause) {
        super(component, message, cause);
    }
}
