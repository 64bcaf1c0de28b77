package com.library.registry.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.util.Locale;

/**
 * Logs every request and reports its processing time, in seconds, in the
 * {@code X-Process-Time} response header. The body is buffered so the header can still be
 * set after the handler has written it.
 */
@Component
public class RequestTimingFilter extends OncePerRequestFilter {

    public static final String PROCESS_TIME_HEADER = "X-Process-Time";

    private static final Logger log = LoggerFactory.getLogger(RequestTimingFilter.class);

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        ContentCachingResponseWrapper wrapper = new ContentCachingResponseWrapper(response);
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, wrapper);
        } finally {
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
            wrapper.setHeader(PROCESS_TIME_HEADER, String.format(Locale.ROOT, "%.4f", seconds));
            log.info("{} {} -> {} ({} s)", request.getMethod(), request.getRequestURI(),
                wrapper.getStatus(), String.format(Locale.ROOT, "%.4f", seconds));
            wrapper.copyBodyToResponse();
        }
    }
}
