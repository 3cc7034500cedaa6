package com.cleanwater.backend.global.web;

import java.util.Optional;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Reads {@link RequestMetadata} for the request bound to the current thread.
 * Empty for work that does not run inside an HTTP request.
 */
@Component
public class RequestMetadataAccessor {

    public Optional<RequestMetadata> current() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (!(attributes instanceof ServletRequestAttributes servletAttributes)) {
            return Optional.empty();
        }
        HttpServletRequest request = servletAttributes.getRequest();
        Object stored = request.getAttribute(RequestIdFilter.METADATA_ATTRIBUTE);
        if (stored instanceof RequestMetadata metadata) {
            return Optional.of(metadata);
        }
        // filter did not run (e.g. MockMvc without the filter registered)
        return Optional.of(new RequestMetadata(
                null,
                RequestIdFilter.resolveClientIp(request),
                request.getHeader(HttpHeaders.USER_AGENT)
        ));
    }
}
