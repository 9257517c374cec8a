package com.collegeportal.backend.modules.auth.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PortalUserRepository extends JpaRepository<PortalUser, UUID> {

    @Query("select pu from PortalUser pu where lower(pu.email) = lower(:email)")
    Optional<PortalUser> findByEmailIgnoreCase(@Param("email") String email);

    boolean existsByEmailIgnoreCase(String email);

    boolean existsByEmailIgnoreCaseAndIdNot(String email, UUID id);

    boolean existsByRole(PortalRole role);
}
