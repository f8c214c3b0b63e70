package com.titanic.inference.security;

import com.titanic.inference.common.ErrorResponse;
import com.titanic.inference.common.ErrorResponseWriter;
import com.titanic.inference.common.RequestContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class AuthFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(AuthFilter.class);
    private static final String BEARER = "Bearer ";

    private final TokenAuthenticator authenticator;
    private final UnverifiedTokenInspector inspector;
    private final ErrorResponseWriter errorWriter;

    public AuthFilter(
        TokenAuthenticator authenticator,
        UnverifiedTokenInspector inspector,
        ErrorResponseWriter errorWriter
    ) {
        this.authenticator = authenticator;
        this.inspector = inspector;
        this.errorWriter = errorWriter;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !requiresAuthentication(request.getRequestURI()) || "OPTIONS".equalsIgnoreCase(request.getMethod());
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String token = extractToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        CallerIdentity identity;
        try {
            identity = authenticator.verify(token);
        } catch (AuthenticationException ex) {
            if (log.isDebugEnabled()) {
                log.debug(
                    "authentication rejected request_id={} reason={} stated_expiry={}",
                    RequestContextHolder.currentRequestId(),
                    ex.getReason().wire(),
                    inspector.inspect(token).map(UnverifiedTokenInspector.UnverifiedClaims::statedExpiry).orElse(null)
                );
            }
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
            errorWriter.write(
                response,
                HttpServletResponse.SC_UNAUTHORIZED,
                ErrorResponse.of("authentication_error", ex.getMessage()).withReason(ex.getReason().wire())
            );
            return;
        }

        try {
            AuthContextHolder.set(identity);
            filterChain.doFilter(request, response);
        } finally {
            AuthContextHolder.clear();
        }
    }

    static boolean requiresAuthentication(String path) {
        if (path == null) {
            return false;
        }
        return path.equals("/predict") || path.equals("/models") || path.startsWith("/models/");
    }

    private static String extractToken(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String trimmed = header.trim();
        if (trimmed.length() < BEARER.length() || !trimmed.regionMatches(true, 0, BEARER, 0, BEARER.length())) {
            return trimmed;
        }
        return trimmed.substring(BEARER.length()).trim();
    }
}
