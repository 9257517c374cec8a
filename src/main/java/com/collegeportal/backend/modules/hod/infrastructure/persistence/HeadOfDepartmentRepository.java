package com.collegeportal.backend.modules.hod.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.modules.hod.domain.HeadOfDepartment;
import com.collegeportal.backend.modules.hod.domain.HodStatus;
import com.collegeportal.backend.modules.people.domain.Department;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface HeadOfDepartmentRepository extends JpaRepository<HeadOfDepartment, UUID> {

    @Query("""
            select h
              from HeadOfDepartment h
              left join fetch h.staff s
              left join fetch s.user
             where h.department = :department
               and h.status = com.collegeportal.backend.modules.hod.domain.HodStatus.ACTIVE
            """)
    Optional<HeadOfDepartment> findActiveByDepartment(@Param("department") Department department);

    @Query("""
            select h
              from HeadOfDepartment h
             where h.staff.userId = :staffUserId
               and h.status = com.collegeportal.backend.modules.hod.domain.HodStatus.ACTIVE
            """)
    Optional<HeadOfDepartment> findActiveByStaffUserId(@Param("staffUserId") UUID staffUserId);

    @Query("select h.department from HeadOfDepartment h where h.id = :id")
    Optional<Department> findDepartmentById(@Param("id") UUID id);

    @Query("""
            select h.department
              from HeadOfDepartment h
             where h.staff.userId = :staffUserId
               and h.status = com.collegeportal.backend.modules.hod.domain.HodStatus.ACTIVE
            """)
    Optional<Department> findActiveDepartmentByStaffUserId(@Param("staffUserId") UUID staffUserId);

    @Query("select h from HeadOfDepartment h where h.staff.userId = :staffUserId")
    List<HeadOfDepartment> findAllByStaffUserId(@Param("staffUserId") UUID staffUserId);

    @Query("""
            select h
              from HeadOfDepartment h
             where (:department is null or h.department = :department)
               and (:status is null or h.status = :status)
             order by h.department asc, h.status asc, h.startDate desc
            """)
    List<HeadOfDepartment> search(
            @Param("department") Department department,
            @Param("status") HodStatus status
    );

    long countByDepartmentAndStatus(Department department, HodStatus status);
}
