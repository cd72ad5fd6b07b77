package com.rivaflow.backend.modules.wearable.application;

public enum SyncStatus {
    REAUTHORIZATION_REQUIRED,
    NO_CANDIDATES,
    AUTO_APPLIED,
    CANDIDATES
}
