package com.rivaflow.backend.modules.session.domain;

/**
 * Partial update of a technique entry; {@code null} leaves a field unchanged.
 * Movement selection goes through {@link TechniqueLedger#selectMovement} instead.
 */
public record TechniquePatch(String notes) {
}
