package com.collegeportal.backend.modules.hod.infrastructure.persistence;

import java.util.Optional;

import com.collegeportal.backend.modules.hod.domain.DepartmentSuccession;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DepartmentSuccessionRepository extends JpaRepository<DepartmentSuccession, String> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select ds from DepartmentSuccession ds where ds.department = :department")
    Optional<DepartmentSuccession> findByIdForUpdate(@Param("department") String department);
}
