package com.cleanwater.backend.modules.whitelist.domain;

import com.cleanwater.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * Registration whitelist entry: a literal address, or a domain pattern starting with {@code @}.
 */
@Entity
@Table(name = "allowed_emails")
public class AllowedEmail extends AbstractTimestampedEntity {

    public static final String DOMAIN_PREFIX = "@";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "email", nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "created_by")
    private Long createdByUserId;

    protected AllowedEmail() {
    }

    public AllowedEmail(String email, Long createdByUserId) {
        this.email = email;
        this.createdByUserId = createdByUserId;
    }

    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public Long getCreatedByUserId() {
        return createdByUserId;
    }

    public boolean isDomainPattern() {
        return email != null && email.startsWith(DOMAIN_PREFIX);
    }
}
