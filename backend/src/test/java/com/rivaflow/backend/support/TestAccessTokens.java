package com.rivaflow.backend.support;

import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.UUID;

import javax.crypto.SecretKey;

import io.jsonwebtoken.Jwts;

/**
 * Signs access tokens the way the external auth service does, for tests only.
 */
public final class TestAccessTokens {

    private TestAccessTokens() {
    }

    public static String issue(SecretKey key, UUID userId, String loginId, List<String> roles,
                               Instant issuedAt, Duration ttl) {
        return Jwts.builder()
                .subject(userId.toString())
                .claim("loginId", loginId)
                .claim("roles", roles)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plus(ttl)))
                .signWith(key)
                .compact();
    }

    public static String issue(SecretKey key, UUID userId) {
        return issue(key, userId, "athlete-" + userId.toString().substring(0, 8), List.of("USER"),
                Instant.now(), Duration.ofMinutes(30));
    }
}
