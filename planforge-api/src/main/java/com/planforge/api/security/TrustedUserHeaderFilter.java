package com.planforge.api.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.UUID;

/**
 * Authenticates requests from the upstream gateway, which has already verified the user and forwards their id
 * in {@value #USER_ID_HEADER}. The principal name is the user id as a string.
 *
 * A missing or malformed header leaves the request anonymous; the security chain then answers 401.
 */
@Slf4j
public class TrustedUserHeaderFilter extends OncePerRequestFilter {

    public static final String USER_ID_HEADER = "X-User-Id";

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {

        String header = request.getHeader(USER_ID_HEADER);
        Authentication existingAuth = SecurityContextHolder.getContext().getAuthentication();

        if (header != null && !header.isBlank() && (existingAuth == null || !existingAuth.isAuthenticated())) {
            UUID userId = parse(header.trim());
            if (userId != null) {
                Authentication authentication = new UsernamePasswordAuthenticationToken(
                    userId.toString(),
                    null,
                    Collections.singletonList(new SimpleGrantedAuthority("ROLE_USER"))
                );
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } else {
                log.warn("[AUTH] Ignoring malformed user header | uri={}", request.getRequestURI());
            }
        }

        filterChain.doFilter(request, response);
    }

    private static UUID parse(String value) {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            log.debug("[AUTH] User header is not a UUID | value={}", value);
            return null;
        }
    }
}
