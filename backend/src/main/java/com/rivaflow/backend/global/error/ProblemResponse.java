package com.rivaflow.backend.global.error;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        List<FieldError> errors
) {

    private static final String DEFAULT_TYPE_PREFIX = "https://rivaflow.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        return of(httpStatus, code, detail, instance, null);
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance,
                                     List<FieldError> errors) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        return new ProblemResponse(
                DEFAULT_TYPE_PREFIX + normalized,
                httpStatus.getReasonPhrase(),
                httpStatus.value(),
                safeDetail,
                instance,
                safeCode,
                (errors == null || errors.isEmpty()) ? null : List.copyOf(errors)
        );
    }

    public record FieldError(String field, String message) {
    }
}
