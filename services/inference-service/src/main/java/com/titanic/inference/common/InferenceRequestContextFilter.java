package com.titanic.inference.common;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class InferenceRequestContextFilter extends OncePerRequestFilter {
    public static final String REQUEST_ID_HEADER = "x-request-id";
    public static final String TRACE_ID_HEADER = "x-trace-id";

    private static final Logger logger = LoggerFactory.getLogger(InferenceRequestContextFilter.class);

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {
        String requestId = IdGenerator.resolveRequestId(request.getHeader(REQUEST_ID_HEADER));
        String traceId = IdGenerator.resolveTraceId(request.getHeader(TRACE_ID_HEADER));
        long startedAt = System.nanoTime();

        RequestContext context = new RequestContext(requestId, traceId, startedAt);
        RequestContextHolder.set(context);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            logger.info(
                "request_id={} trace_id={} method={} path={} status={} latency_ms={}",
                requestId,
                traceId,
                request.getMethod(),
                request.getRequestURI(),
                response.getStatus(),
                context.elapsedMs()
            );
            RequestContextHolder.clear();
        }
    }
}
