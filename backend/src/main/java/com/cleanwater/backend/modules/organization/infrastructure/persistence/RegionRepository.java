package com.cleanwater.backend.modules.organization.infrastructure.persistence;

import com.cleanwater.backend.modules.organization.domain.Region;

import org.springframework.data.jpa.repository.JpaRepository;

public interface RegionRepository extends JpaRepository<Region, Long> {
}
