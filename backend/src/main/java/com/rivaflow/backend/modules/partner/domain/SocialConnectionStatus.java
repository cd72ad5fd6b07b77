package com.rivaflow.backend.modules.partner.domain;

public enum SocialConnectionStatus {
    ACCEPTED,
    SUGGESTED
}
