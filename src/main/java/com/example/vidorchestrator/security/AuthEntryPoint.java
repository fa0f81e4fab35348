package com.example.vidorchestrator.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * Answers requests that reached a protected endpoint without a usable user header.
 * The problem body names the header so clients know what to send.
 */
@Component
public class AuthEntryPoint implements AuthenticationEntryPoint {

    private static final Logger log = LoggerFactory.getLogger(AuthEntryPoint.class);

    private final ObjectMapper objectMapper;
    private final String userHeader;

    public AuthEntryPoint(ObjectMapper objectMapper,
                          @Value("${security.user-header:X-User-Id}") String userHeader) {
        this.objectMapper = objectMapper;
        this.userHeader = userHeader;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) {
        boolean headerPresent = request.getHeader(userHeader) != null;
        String detail = headerPresent
                ? "The " + userHeader + " header is blank; a user identity is required."
                : "The " + userHeader + " header is missing; a user identity is required.";
        log.warn("Rejected {} {}: {} header {}", request.getMethod(), request.getRequestURI(),
                userHeader, headerPresent ? "blank" : "missing");

        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(HttpStatus.UNAUTHORIZED, detail);
        problemDetail.setTitle("Unauthorized");
        problemDetail.setInstance(URI.create(request.getRequestURI()));
        problemDetail.setProperty("requiredHeader", userHeader);
        problemDetail.setProperty("timestamp", Instant.now());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        try {
            objectMapper.writeValue(response.getWriter(), problemDetail);
        } catch (IOException e) {
            log.error("Failed to write unauthorized response for {}", request.getRequestURI(), e);
        }
    }
}
