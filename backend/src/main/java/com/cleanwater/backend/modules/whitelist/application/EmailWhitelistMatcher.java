package com.cleanwater.backend.modules.whitelist.application;

import java.util.Collection;

import com.cleanwater.backend.modules.whitelist.domain.AllowedEmail;
import com.cleanwater.backend.modules.whitelist.infrastructure.persistence.AllowedEmailRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Decides whether an address may self-register.
 *
 * <p>An exact literal entry wins first. Otherwise the part after the single {@code @} is compared
 * with every {@code @domain} entry: it matches when it equals the domain or ends with
 * {@code "." + domain}. {@code dept.hospital.org} is therefore covered by {@code @hospital.org},
 * while {@code notexample.com} is not covered by {@code @example.com}. Comparison is case-sensitive.
 */
@Component
public class EmailWhitelistMatcher {

    private final AllowedEmailRepository allowedEmailRepository;

    public EmailWhitelistMatcher(AllowedEmailRepository allowedEmailRepository) {
        this.allowedEmailRepository = allowedEmailRepository;
    }

    @Transactional(readOnly = true)
    public boolean isAllowed(String candidate) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        if (allowedEmailRepository.existsByEmail(candidate)) {
            return true;
        }
        String domain = domainOf(candidate);
        if (domain == null) {
            return false;
        }
        return allowedEmailRepository.findByEmailStartingWith(AllowedEmail.DOMAIN_PREFIX).stream()
                .map(AllowedEmail::getEmail)
                .anyMatch(entry -> domainMatches(domain, entry.substring(1)));
    }

    /**
     * Same decision against an in-memory list of entries.
     */
    public static boolean matches(String candidate, Collection<String> entries) {
        if (candidate == null || candidate.isEmpty()) {
            return false;
        }
        if (entries.contains(candidate)) {
            return true;
        }
        String domain = domainOf(candidate);
        if (domain == null) {
            return false;
        }
        return entries.stream()
                .filter(entry -> entry.startsWith(AllowedEmail.DOMAIN_PREFIX))
                .anyMatch(entry -> domainMatches(domain, entry.substring(1)));
    }

    static boolean domainMatches(String domain, String whitelistedDomain) {
        if (whitelistedDomain.isEmpty()) {
            return false;
        }
        return domain.equals(whitelistedDomain) || domain.endsWith("." + whitelistedDomain);
    }

    // null unless the address has exactly one '@'
    private static String domainOf(String candidate) {
        int at = candidate.indexOf('@');
        if (at < 0 || at != candidate.lastIndexOf('@')) {
            return null;
        }
        return candidate.substring(at + 1);
    }
}
