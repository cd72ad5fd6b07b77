package com.rivaflow.backend.modules.session.domain;

public enum TrackingMode {
    SIMPLE,
    DETAILED
}
