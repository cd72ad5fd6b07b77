package com.rivaflow.backend.global.security;

import java.util.UUID;

import com.rivaflow.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

public final class SecurityUtils {

    private SecurityUtils() {
    }

    /**
     * Owner id of the calling athlete. Controllers pass it to every service call so that no
     * query can reach another athlete's sessions, contacts or workouts.
     */
    public static UUID getCurrentOwnerId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getPrincipal() instanceof AthletePrincipal athlete) {
            return athlete.ownerId();
        }
        throw new ProblemException(HttpStatus.UNAUTHORIZED, RestAuthenticationEntryPoint.AUTHENTICATION_REQUIRED,
                "No authenticated athlete on this request");
    }
}
