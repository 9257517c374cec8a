package com.collegeportal.backend.modules.people.presentation.dto;

import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.modules.people.domain.Staff;
import com.collegeportal.backend.modules.people.domain.Student;

public final class PeopleDtoMapper {

    private PeopleDtoMapper() {
    }

    public static StudentResponse toResponse(Student student) {
        Department department = student.getDepartment();
        return new StudentResponse(
                toUser(student.getUser()),
                student.getStudentId(),
                student.getDateOfBirth(),
                student.getGender(),
                student.getPhone(),
                student.getAddress(),
                department != null ? department.name() : null,
                department != null ? department.getDisplayName() : null,
                student.getEnrollmentDate(),
                student.getCreatedAt(),
                student.getUpdatedAt()
        );
    }

    public static StaffResponse toResponse(Staff staff) {
        Department department = staff.getDepartment();
        return new StaffResponse(
                toUser(staff.getUser()),
                staff.getStaffId(),
                staff.getDateOfBirth(),
                staff.getGender(),
                staff.getPhone(),
                staff.getAddress(),
                department != null ? department.name() : null,
                department != null ? department.getDisplayName() : null,
                staff.getDesignation(),
                staff.getQualification(),
                staff.getSalary(),
                staff.getJoiningDate(),
                staff.getCreatedAt(),
                staff.getUpdatedAt()
        );
    }

    private static PersonUserResponse toUser(PortalUser user) {
        return new PersonUserResponse(
                user.getId(),
                user.getEmail(),
                user.getFirstName(),
                user.getLastName(),
                user.getFullName(),
                user.getRole(),
                user.isActive()
        );
    }
}
