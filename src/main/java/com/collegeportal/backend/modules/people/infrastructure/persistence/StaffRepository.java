package com.collegeportal.backend.modules.people.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.modules.people.domain.Staff;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface StaffRepository extends JpaRepository<Staff, UUID> {

    @Query("select s from Staff s join fetch s.user where s.staffId = :staffId")
    Optional<Staff> findByStaffId(@Param("staffId") String staffId);

    boolean existsByStaffId(String staffId);

    boolean existsByStaffIdAndUserIdNot(String staffId, UUID userId);

    @Query("select s from Staff s join fetch s.user u order by u.createdAt desc")
    List<Staff> findAllNewestFirst();
}
