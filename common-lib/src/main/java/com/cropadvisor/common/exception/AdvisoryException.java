package com.cropadvisor.common.exception;

/**
 * Root of the advisory error hierarchy. Carries the name of the component that raised it.
 */
public class AdvisoryException extends RuntimeException {
    private final String component;

    public AdvisoryException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AdvisoryException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
