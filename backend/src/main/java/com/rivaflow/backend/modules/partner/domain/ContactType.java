package com.rivaflow.backend.modules.partner.domain;

public enum ContactType {
    TRAINING_PARTNER,
    INSTRUCTOR,
    BOTH;

    public boolean isTrainingPartner() {
        return this == TRAINING_PARTNER || this == BOTH;
    }

    public boolean isInstructor() {
        return this == INSTRUCTOR || this == BOTH;
    }
}
