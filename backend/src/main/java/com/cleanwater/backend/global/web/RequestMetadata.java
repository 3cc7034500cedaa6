package com.cleanwater.backend.global.web;

/**
 * Caller-side facts about the current HTTP request, used to enrich audit records.
 */
public record RequestMetadata(String requestId, String clientIp, String userAgent) {
}
