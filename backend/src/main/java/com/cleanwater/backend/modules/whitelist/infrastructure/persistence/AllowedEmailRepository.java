package com.cleanwater.backend.modules.whitelist.infrastructure.persistence;

import java.util.List;

import com.cleanwater.backend.modules.whitelist.domain.AllowedEmail;

import org.springframework.data.jpa.repository.JpaRepository;

public interface AllowedEmailRepository extends JpaRepository<AllowedEmail, Long> {

    boolean existsByEmail(String email);

    List<AllowedEmail> findByEmailStartingWith(String prefix);

    List<AllowedEmail> findAllByOrderByEmailAsc();
}
