package com.cropadvisor.common.exception;

/**
 * The farmer's profile, active crop or location is missing but the intent's route needs it.
 * Surfaced to the client as an onboarding prompt, never as an error status.
 */
public class ProfileIncompleteException extends AdvisoryException {
    private final Long farmerId;
    private final String missing;

    public ProfileIncompleteException(Long farmerId, String missing) {
        super("DecisionOrchestrator", "farmer " + farmerId + " is missing " + missing);
        this.farmerId = farmerId;
        this.missing = missing;
    }

    public Long getFarmerId() {
        return farmerId;
    }

    public String getMissing() {
        return missing;
    }
}
