package com.rivaflow.backend.global.security;

import java.util.UUID;

/**
 * The authenticated athlete. Every training record is scoped by {@code ownerId}; the login id
 * is kept for log lines only.
 */
public record AthletePrincipal(UUID ownerId, String loginId) {
}
