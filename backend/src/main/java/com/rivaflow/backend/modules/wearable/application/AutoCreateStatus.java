package com.rivaflow.backend.modules.wearable.application;

public enum AutoCreateStatus {
    DISABLED,
    REAUTHORIZATION_REQUIRED,
    COMPLETED
}
