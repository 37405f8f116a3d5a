package com.gridpulse.analytics.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Correlates log lines and error bodies of one request. A caller-supplied trace id is reused when it is a plain
 * token of at most {@value #MAX_TRACE_ID_LENGTH} characters; anything else is replaced by a random UUID.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(TraceIdFilter.class);

    public static final String TRACE_HEADER = "X-Request-Trace";
    public static final String MDC_KEY = "trace_id";
    static final int MAX_TRACE_ID_LENGTH = 64;

    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1," + MAX_TRACE_ID_LENGTH + "}");

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TRACE_HEADER));
        String path = request.getRequestURI();
        long startedAt = System.nanoTime();
        RequestContextHolder.set(new RequestContextHolder.RequestContext(traceId, path));
        MDC.put(MDC_KEY, traceId);
        response.setHeader(TRACE_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            log.debug("{} {} -> {} in {} ms", request.getMethod(), path, response.getStatus(),
                    (System.nanoTime() - startedAt) / 1_000_000);
            MDC.remove(MDC_KEY);
            RequestContextHolder.clear();
        }
    }

    static String resolveTraceId(String supplied) {
        if (supplied != null && SAFE_TRACE_ID.matcher(supplied.trim()).matches()) {
            return supplied.trim();
        }
        return UUID.randomUUID().toString();
    }
}
