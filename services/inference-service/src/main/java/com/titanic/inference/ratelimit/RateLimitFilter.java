package com.titanic.inference.ratelimit;

import com.titanic.inference.common.ErrorResponse;
import com.titanic.inference.common.ErrorResponseWriter;
import com.titanic.inference.common.RequestContextHolder;
import com.titanic.inference.security.AuthContextHolder;
import com.titanic.inference.security.CallerIdentity;
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
@Order(Ordered.HIGHEST_PRECEDENCE + 20)
public class RateLimitFilter extends OncePerRequestFilter {
    static final String LIMIT_HEADER = "X-RateLimit-Limit";
    static final String REMAINING_HEADER = "X-RateLimit-Remaining";

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final RateLimitService rateLimitService;
    private final ErrorResponseWriter errorWriter;

    public RateLimitFilter(RateLimitService rateLimitService, ErrorResponseWriter errorWriter) {
        this.rateLimitService = rateLimitService;
        this.errorWriter = errorWriter;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String endpoint = resolveEndpoint(request.getRequestURI());
        if (!rateLimitService.getProperties().isEnabled() || endpoint == null) {
            filterChain.doFilter(request, response);
            return;
        }

        String identity = resolveIdentity(request);
        RateLimitDecision decision;
        try {
            decision = rateLimitService.allow(identity, endpoint);
        } catch (RateLimitUnavailableException ex) {
            log.error(
                "rate limiter unavailable request_id={} trace_id={} endpoint={}",
                RequestContextHolder.currentRequestId(),
                RequestContextHolder.currentTraceId(),
                endpoint,
                ex
            );
            errorWriter.write(
                response,
                HttpServletResponse.SC_SERVICE_UNAVAILABLE,
                ErrorResponse.of("rate_limiter_unavailable", "Rate limiting is temporarily unavailable")
            );
            return;
        }

        response.setHeader(LIMIT_HEADER, String.valueOf(decision.limit()));
        response.setHeader(REMAINING_HEADER, String.valueOf(decision.remaining()));
        if (!decision.permitted()) {
            log.info("rate limit exceeded request_id={} endpoint={} identity={}",
                RequestContextHolder.currentRequestId(), endpoint, identity);
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(decision.retryAfterSeconds()));
            errorWriter.write(
                response,
                429,
                ErrorResponse.of("rate_limit_exceeded", "Too many requests, retry after "
                    + decision.retryAfterSeconds() + " seconds")
            );
            return;
        }

        filterChain.doFilter(request, response);
    }

    static String resolveEndpoint(String path) {
        if (path == null) {
            return null;
        }
        if (path.equals("/predict")) {
            return "predict";
        }
        if (path.equals("/models") || path.startsWith("/models/")) {
            return "models";
        }
        return null;
    }

    private static String resolveIdentity(HttpServletRequest request) {
        CallerIdentity identity = AuthContextHolder.get();
        if (identity != null) {
            return "user:" + identity.userId();
        }
        String forwarded = request.getHeader("x-forwarded-for");
        if (forwarded != null && !forwarded.isBlank()) {
            return "ip:" + forwarded.split(",")[0].trim();
        }
        return "ip:" + request.getRemoteAddr();
    }
}
