package com.collegeportal.backend.modules.people.application;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.access.domain.Actor;
import com.collegeportal.backend.modules.access.domain.PortalAction;
import com.collegeportal.backend.modules.access.domain.ResourceKind;
import com.collegeportal.backend.modules.access.domain.RolePolicy;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.auth.domain.PortalUser;
import com.collegeportal.backend.modules.people.application.PersonAccountSupport.Demographics;
import com.collegeportal.backend.modules.people.application.PersonAccountSupport.NewAccount;
import com.collegeportal.backend.modules.people.domain.Student;
import com.collegeportal.backend.modules.people.infrastructure.persistence.StudentRepository;
import com.collegeportal.backend.modules.people.presentation.dto.CreateStudentRequest;
import com.collegeportal.backend.modules.people.presentation.dto.PeopleDtoMapper;
import com.collegeportal.backend.modules.people.presentation.dto.StudentResponse;
import com.collegeportal.backend.modules.people.presentation.dto.UpdateStudentRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class StudentService {

    private static final Logger log = LoggerFactory.getLogger(StudentService.class);

    static final String DUPLICATE_STUDENT_ID_MESSAGE = "A student with this ID already exists.";

    private final StudentRepository studentRepository;
    private final PersonAccountSupport accountSupport;
    private final Clock clock;

    public StudentService(StudentRepository studentRepository, PersonAccountSupport accountSupport, Clock clock) {
        this.studentRepository = studentRepository;
        this.accountSupport = accountSupport;
        this.clock = clock;
    }

    public StudentResponse addStudent(Actor actor, CreateStudentRequest request) {
        RolePolicy.require(actor, PortalAction.CREATE, ResourceKind.STUDENT);

        Map<String, String> profileErrors = new LinkedHashMap<>();
        String studentId = request.studentId().trim();
        if (studentRepository.existsByStudentId(studentId)) {
            profileErrors.put("studentId", DUPLICATE_STUDENT_ID_MESSAGE);
        }
        PortalUser user = accountSupport.createAccount(
                new NewAccount(request.email(), request.firstName(), request.lastName(),
                        request.password(), request.passwordConfirm()),
                PortalRole.STUDENT,
                profileErrors
        );

        Student student = new Student(user, studentId, LocalDate.now(clock));
        accountSupport.applyDemographics(student, new Demographics(
                request.dateOfBirth(), request.gender(), request.phone(), request.address(), request.department()), false);
        Student saved = studentRepository.saveAndFlush(student);
        log.info("Added student {} ({})", saved.getStudentId(), user.getId());
        return PeopleDtoMapper.toResponse(saved);
    }

    @Transactional(readOnly = true)
    public List<StudentResponse> listStudents(Actor actor) {
        RolePolicy.require(actor, PortalAction.LIST, ResourceKind.STUDENT);
        return studentRepository.findAllNewestFirst().stream()
                .map(PeopleDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public StudentResponse getStudent(Actor actor, String studentId) {
        RolePolicy.require(actor, PortalAction.READ, ResourceKind.STUDENT);
        return PeopleDtoMapper.toResponse(findStudent(studentId));
    }

    /**
     * @param replace {@code true} for a full replacement (PUT), {@code false} for a partial update
     */
    public StudentResponse updateStudent(Actor actor, String studentId, UpdateStudentRequest request, boolean replace) {
        RolePolicy.require(actor, PortalAction.UPDATE, ResourceKind.STUDENT);
        Student student = findStudent(studentId);

        Map<String, String> errors = new LinkedHashMap<>();
        accountSupport.applyUserChanges(student.getUser(), request.email(), request.firstName(), request.lastName(),
                replace, errors);
        if (replace) {
            PersonAccountSupport.requirePresent("studentId", request.studentId(), errors);
        }
        String newStudentId = PersonAccountSupport.blankToNull(request.studentId());
        if (newStudentId != null && !newStudentId.equals(student.getStudentId())) {
            if (studentRepository.existsByStudentIdAndUserIdNot(newStudentId, student.getUserId())) {
                errors.put("studentId", DUPLICATE_STUDENT_ID_MESSAGE);
            } else {
                student.setStudentId(newStudentId);
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationProblemException("Request could not be validated.", errors);
        }

        accountSupport.applyDemographics(student, new Demographics(
                request.dateOfBirth(), request.gender(), request.phone(), request.address(), request.department()), replace);
        accountSupport.enforceRole(student.getUser(), PortalRole.STUDENT);
        return PeopleDtoMapper.toResponse(studentRepository.saveAndFlush(student));
    }

    /**
     * Removes the student profile and the account it belongs to.
     */
    public void deleteStudent(Actor actor, String studentId) {
        RolePolicy.require(actor, PortalAction.DELETE, ResourceKind.STUDENT);
        Student student = findStudent(studentId);
        PortalUser user = student.getUser();
        studentRepository.delete(student);
        studentRepository.flush();
        accountSupport.deleteAccount(user);
        log.info("Deleted student {} and account {}", studentId, user.getId());
    }

    private Student findStudent(String studentId) {
        return studentRepository.findByStudentId(studentId)
                .orElseThrow(() -> ProblemException.notFound("student.not_found", "Student " + studentId + " not found."));
    }
}
