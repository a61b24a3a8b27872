package com.flagship.medexchange_ledger.security;

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
import java.util.Locale;

/**
 * Reads the caller identity the gateway forwards in {@code X-Caller-*} headers.
 *
 * Requests without a usable identity pass through unauthenticated; each handler
 * decides whether that is acceptable (the payment webhook authenticates by
 * signature instead).
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@Slf4j
public class CallerIdentityFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        try {
            CallerIdentity identity = extractIdentity(request);
            if (identity != null) {
                CallerContext.set(identity);
                MDC.put(CallerContext.CALLER_ID_MDC_KEY, identity.getUserId());
            }
            filterChain.doFilter(request, response);
        } finally {
            CallerContext.clear();
            MDC.remove(CallerContext.CALLER_ID_MDC_KEY);
        }
    }

    private CallerIdentity extractIdentity(HttpServletRequest request) {
        String userId = request.getHeader(CallerContext.CALLER_ID_HEADER);
        String role = request.getHeader(CallerContext.CALLER_ROLE_HEADER);
        if (userId == null || userId.isBlank() || role == null || role.isBlank()) {
            return null;
        }
        try {
            CallerRole callerRole = CallerRole.valueOf(role.trim().toUpperCase(Locale.ROOT));
            return CallerIdentity.of(userId.trim(), callerRole, request.getHeader(CallerContext.CALLER_CITY_HEADER));
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring caller identity with unknown role: {}", role);
            return null;
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
