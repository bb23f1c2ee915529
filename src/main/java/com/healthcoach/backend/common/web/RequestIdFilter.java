package com.healthcoach.backend.common.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id (client supplied or generated), exposes it to
 * the log pattern through MDC and echoes it back in the response header.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-Request-Id";
    public static final String ATTR = "requestId";
    public static final String MDC_KEY = "rid";

    private static final int MAX_LEN = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {

        String rid = sanitize(req.getHeader(HEADER));
        req.setAttribute(ATTR, rid);
        MDC.put(MDC_KEY, rid);
        res.setHeader(HEADER, rid);

        long started = System.nanoTime();
        try {
            chain.doFilter(req, res);
        } finally {
            long ms = (System.nanoTime() - started) / 1_000_000L;
            log.debug("{} {} -> {} ({} ms)", req.getMethod(), req.getRequestURI(), res.getStatus(), ms);
            MDC.remove(MDC_KEY);
        }
    }

    /** blank or oversized ids are replaced, so headers cannot flood the logs */
    static String sanitize(String raw) {
        if (raw == null || raw.isBlank()) return UUID.randomUUID().toString();
        String v = raw.trim();
        return (v.length() > MAX_LEN) ? v.substring(0, MAX_LEN) : v;
    }

    public static String current(HttpServletRequest req) {
        Object v = req.getAttribute(ATTR);
        return (v == null) ? null : String.valueOf(v);
    }
}
