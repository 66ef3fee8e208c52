package org.caureq.opsanomaly.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.caureq.opsanomaly.config.AppProps;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Collectors pushing samples must present X-API-KEY. */
@Slf4j
@Component
@RequiredArgsConstructor
public class ApiKeyFilter extends OncePerRequestFilter {
    static final String INGEST_PATH = "/api/ingest";

    private final AppProps props;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest req) {
        return !req.getRequestURI().startsWith(INGEST_PATH);
    }

    @Override
    protected void doFilterInternal(HttpServletRequest req, HttpServletResponse res, FilterChain chain)
            throws ServletException, IOException {
        if (!KeyChecks.matches(props.apiKey(), req.getHeader("X-API-KEY"))) {
            log.debug("[Ingest] rejected push from {}", req.getRemoteAddr());
            KeyChecks.reject(res, HttpStatus.UNAUTHORIZED, "Missing or invalid X-API-KEY");
            return;
        }
        chain.doFilter(req, res);
    }
}
