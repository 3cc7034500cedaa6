package com.cleanwater.backend.global.web;

import java.io.IOException;
import java.util.UUID;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Assigns a request id, resolves the client address and publishes both to the MDC and to a
 * request attribute read by {@link RequestMetadataAccessor}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String METADATA_ATTRIBUTE = RequestMetadata.class.getName();
    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final String REQUEST_ID_MDC_KEY = "requestId";
    private static final String CLIENT_IP_MDC_KEY = "clientIp";
    private static final int MAX_REQUEST_ID_LENGTH = 64;
    private static final int MAX_USER_AGENT_LENGTH = 255;
    private static final int MAX_CLIENT_IP_LENGTH = 45;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        RequestMetadata metadata = new RequestMetadata(
                resolveRequestId(request),
                resolveClientIp(request),
                truncate(request.getHeader(HttpHeaders.USER_AGENT), MAX_USER_AGENT_LENGTH)
        );
        MDC.put(REQUEST_ID_MDC_KEY, metadata.requestId());
        if (metadata.clientIp() != null) {
            MDC.put(CLIENT_IP_MDC_KEY, metadata.clientIp());
        }
        request.setAttribute(METADATA_ATTRIBUTE, metadata);
        response.setHeader(REQUEST_ID_HEADER, metadata.requestId());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_MDC_KEY);
            MDC.remove(CLIENT_IP_MDC_KEY);
        }
    }

    static String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        if (StringUtils.hasText(forwarded)) {
            String firstHop = forwarded.split(",")[0].trim();
            if (!firstHop.isEmpty()) {
                return truncate(firstHop, MAX_CLIENT_IP_LENGTH);
            }
        }
        return request.getRemoteAddr();
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header)) {
            return truncate(header.trim(), MAX_REQUEST_ID_LENGTH);
        }
        return UUID.randomUUID().toString();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
