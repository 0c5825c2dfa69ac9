package com.cropadvisor.evaluator.context;

import com.cropadvisor.common.model.CropRegistration;

/**
 * @param proposedRegistration crop to register, only for the onboarding intent
 * @param registrationProblem  why a requested registration could not be proposed, or {@code null}
 */
public record ContextReport(String summary, CropRegistration proposedRegistration,
                            String registrationProblem, String justification) {

    public boolean hasRegistration() {
        return proposedRegistration != null;
    }
}
