package com.rivaflow.backend.global.security;

import java.io.IOException;

import com.rivaflow.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 problem bodies. A request that carried a bearer token which failed verification gets
 * {@code invalid_token} so clients know to fetch a new token instead of signing in again.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    public static final String AUTHENTICATION_REQUIRED = "authentication_required";
    public static final String INVALID_TOKEN = "invalid_token";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean rejectedToken = authException instanceof BadCredentialsException;
        String code = rejectedToken ? INVALID_TOKEN : AUTHENTICATION_REQUIRED;
        String detail = rejectedToken
                ? "Access token is invalid or expired"
                : "A bearer access token is required";
        ProblemResponse body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, code, detail, request.getRequestURI());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE,
                rejectedToken ? "Bearer error=\"" + INVALID_TOKEN + "\"" : "Bearer");
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
