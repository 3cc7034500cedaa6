package com.cleanwater.backend.modules.organization.infrastructure.persistence;

import java.util.Optional;

import com.cleanwater.backend.modules.organization.domain.Hospital;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HospitalRepository extends JpaRepository<Hospital, Long>, JpaSpecificationExecutor<Hospital> {

    @EntityGraph(attributePaths = "region")
    @Query("select h from Hospital h where h.id = :id")
    Optional<Hospital> findWithRegionById(@Param("id") Long id);
}
