package com.rivaflow.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.rivaflow.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;

import org.springframework.stereotype.Service;

/**
 * Verifies access tokens issued by the external auth service. Login, refresh and
 * token issuing live in that service; this backend only reads the claims.
 */
@Service
public class AccessTokenVerifier {

    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    public AccessTokenVerifier(JwtTokenProvider tokenProvider, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.clock = clock;
    }

    public VerifiedToken verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            UUID userId = UUID.fromString(claims.getSubject());
            String loginId = claims.get("loginId", String.class);
            List<?> rolesClaim = claims.get("roles", List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();
            Instant expiresAt = claims.getExpiration() != null ? claims.getExpiration().toInstant() : clock.instant();

            return new VerifiedToken(userId, loginId, roles, OffsetDateTime.ofInstant(expiresAt, clock.getZone()));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record VerifiedToken(UUID userId, String loginId, List<String> roles, OffsetDateTime expiresAt) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
