package com.rivaflow.backend.modules.session.domain;

public record FieldViolation(String field, String message) {
}
