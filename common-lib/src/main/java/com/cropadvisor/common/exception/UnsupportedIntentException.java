package com.cropadvisor.common.exception;

public class UnsupportedIntentException extends AdvisoryException {
    private final String intent;

    public UnsupportedIntentException(String intent) {
        super("DecisionOrchestrator", "unsupported intent '" + intent + "'");
        this.intent = intent;
    }

    public String getIntent() {
        return intent;
    }
}
