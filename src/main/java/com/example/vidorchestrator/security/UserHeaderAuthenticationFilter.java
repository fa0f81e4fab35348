package com.example.vidorchestrator.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.lang.NonNull;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.AuthorityUtils;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.preauth.PreAuthenticatedAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Trusts the user id forwarded by the gateway in a request header. Requests without it stay
 * anonymous and are rejected by the entry point.
 */
@Component
public class UserHeaderAuthenticationFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(UserHeaderAuthenticationFilter.class);

    private final String userHeader;

    public UserHeaderAuthenticationFilter(@Value("${security.user-header:X-User-Id}") String userHeader) {
        this.userHeader = userHeader;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {

        String userId = request.getHeader(userHeader);

        if (userId != null && !userId.isBlank()) {
            Authentication authentication = new PreAuthenticatedAuthenticationToken(
                    userId.trim(),
                    null,
                    AuthorityUtils.createAuthorityList("ROLE_USER"));
            SecurityContextHolder.getContext().setAuthentication(authentication);
            log.debug("Pre-authenticated user '{}' from header {}.", userId, userHeader);
        } else {
            SecurityContextHolder.clearContext();
            log.debug("No {} header on request to {}. Security context cleared.", userHeader, request.getRequestURI());
        }

        filterChain.doFilter(request, response);
    }
}
