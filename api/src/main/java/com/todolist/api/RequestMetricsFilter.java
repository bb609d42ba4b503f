package com.todolist.api;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;

/**
 * Records one request count and one latency observation per request, whatever the outcome.
 */
@Component
public class RequestMetricsFilter extends OncePerRequestFilter {
    private static final Logger logger = LoggerFactory.getLogger(RequestMetricsFilter.class);

    static final String UNMATCHED = "UNMATCHED";

    private final TodoMetrics metrics;

    public RequestMetricsFilter(TodoMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        long t0 = System.nanoTime();
        boolean failed = true;
        try {
            chain.doFilter(req, res);
            failed = false;
        } finally {
            long elapsed = System.nanoTime() - t0;
            int status = failed ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR : res.getStatus();
            String endpoint = endpoint(req);
            metrics.recordRequest(req.getMethod(), endpoint, status, elapsed);
            logger.debug("[DEBUG] {} {} -> {} ({}ms)", req.getMethod(), endpoint, status, elapsed / 1_000_000);
        }
    }

    // Route pattern rather than raw URI keeps label cardinality bounded.
    private static String endpoint(HttpServletRequest req) {
        Object pattern = req.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : UNMATCHED;
    }
}
