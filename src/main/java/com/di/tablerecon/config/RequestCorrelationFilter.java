package com.di.tablerecon.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts a {@code requestId} into the MDC for each HTTP request and echoes it in the
 * {@value #HEADER} response header. A caller-supplied header value is reused when it is a
 * plain token, so a scheduler can correlate its own logs with ours.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String REQUEST_ID = "requestId";

    private static final int MAX_INCOMING_LENGTH = 64;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = requestId(request.getHeader(HEADER));
        MDC.put(REQUEST_ID, requestId);
        response.setHeader(HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
        }
    }

    static String requestId(String incoming) {
        if (incoming != null && !incoming.isBlank() && incoming.length() <= MAX_INCOMING_LENGTH
                && incoming.matches("[A-Za-z0-9._-]+")) {
            return incoming;
        }
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
