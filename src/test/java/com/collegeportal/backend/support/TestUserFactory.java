package com.collegeportal.backend.support;

import java.time.LocalDate;

import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.auth.infrastructure.persistence.PortalUserRepository;
import com.collegeportal.backend.modules.people.domain.Department;
import com.collegeportal.backend.modules.people.domain.Staff;
import com.collegeportal.backend.modules.people.domain.Student;
import com.collegeportal.backend.modules.people.infrastructure.persistence.StaffRepository;
import com.collegeportal.backend.modules.people.infrastructure.persistence.StudentRepository;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class TestUserFactory {

    private final PortalUserRepository portalUserRepository;
    private final StudentRepository studentRepository;
    private final StaffRepository staffRepository;
    private final PasswordEncoder passwordEncoder;

    public TestUserFactory(
            PortalUserRepository portalUserRepository,
            StudentRepository studentRepository,
            StaffRepository staffRepository,
            PasswordEncoder passwordEncoder
    ) {
        this.portalUserRepository = portalUserRepository;
        this.studentRepository = studentRepository;
        this.staffRepository = staffRepository;
        this.passwordEncoder = passwordEncoder;
    }

    public PortalUser ensureAdmin(String email, String rawPassword) {
        return ensureUser(email, rawPassword, "Admin", "User", PortalRole.ADMIN);
    }

    public Staff ensureStaff(String staffId, String email, String rawPassword, Department department) {
        return staffRepository.findByStaffId(staffId).orElseGet(() -> {
            PortalUser user = ensureUser(email, rawPassword, "Staff", staffId, PortalRole.STAFF);
            Staff staff = new Staff(user, staffId, LocalDate.of(2020, 7, 1));
            staff.setDepartment(department);
            staff.setDesignation("Professor");
            return staffRepository.saveAndFlush(staff);
        });
    }

    public Student ensureStudent(String studentId, String email, String rawPassword) {
        return studentRepository.findByStudentId(studentId).orElseGet(() -> {
            PortalUser user = ensureUser(email, rawPassword, "Student", studentId, PortalRole.STUDENT);
            Student student = new Student(user, studentId, LocalDate.of(2024, 8, 1));
            student.setDepartment(Department.CS);
            return studentRepository.saveAndFlush(student);
        });
    }

    public PortalUser ensureUser(String email, String rawPassword, String firstName, String lastName, PortalRole role) {
        PortalUser user = portalUserRepository.findByEmailIgnoreCase(email).orElseGet(() -> {
            PortalUser created = new PortalUser();
            created.setInitialRole(role);
            return created;
        });
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(rawPassword));
        user.setFirstName(firstName);
        user.setLastName(lastName);
        user.setActive(true);
        user.setStaff(role != PortalRole.STUDENT);
        return portalUserRepository.save(user);
    }

    public void deactivate(String email) {
        portalUserRepository.findByEmailIgnoreCase(email).ifPresent(user -> {
            user.setActive(false);
            portalUserRepository.save(user);
        });
    }
}
