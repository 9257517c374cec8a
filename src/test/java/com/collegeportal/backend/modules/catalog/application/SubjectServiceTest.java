package com.collegeportal.backend.modules.catalog.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.RetryableProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.access.domain.Actor;
import com.collegeportal.backend.modules.auth.domain.PortalRole;
import com.collegeportal.backend.modules.catalog.domain.AcademicDepartment;
import com.collegeportal.backend.modules.catalog.domain.Subject;
import com.collegeportal.backend.modules.catalog.domain.Syllabus;
import com.collegeportal.backend.modules.catalog.infrastructure.persistence.SubjectRepository;
import com.collegeportal.backend.modules.catalog.infrastructure.persistence.SyllabusRepository;
import com.collegeportal.backend.modules.catalog.presentation.dto.CreateSubjectRequest;
import com.collegeportal.backend.modules.catalog.presentation.dto.SubjectResponse;
import com.collegeportal.backend.modules.catalog.presentation.dto.UpdateSubjectRequest;
import com.collegeportal.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

@ExtendWith(MockitoExtension.class)
class SubjectServiceTest {

    private static final Actor STAFF = new Actor(UUID.randomUUID(), PortalRole.STAFF, true);
    private static final Actor STUDENT = new Actor(UUID.randomUUID(), PortalRole.STUDENT, false);

    @Mock
    private SubjectRepository subjectRepository;

    @Mock
    private SyllabusRepository syllabusRepository;

    @Mock
    private SubjectCodeGenerator subjectCodeGenerator;

    @Mock
    private PlatformTransactionManager transactionManager;

    private SubjectService subjectService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        subjectService = new SubjectService(subjectRepository, syllabusRepository, subjectCodeGenerator,
                transactionManager, 3, clock);
    }

    @Test
    @DisplayName("create assigns the generated code and stores the optional syllabus")
    void createAssignsGeneratedCode() {
        stubTransactions();
        when(subjectCodeGenerator.nextCode(AcademicDepartment.CS, 1)).thenReturn("CS101");
        when(subjectRepository.saveAndFlush(any(Subject.class))).thenAnswer(invocation -> invocation.getArgument(0));
        when(syllabusRepository.saveAndFlush(any(Syllabus.class))).thenAnswer(invocation -> invocation.getArgument(0));

        SubjectResponse response = subjectService.create(STAFF,
                new CreateSubjectRequest("  Data Structures ", AcademicDepartment.CS, 1, "https://example.org/ds.pdf"));

        assertThat(response.subjectCode()).isEqualTo("CS101");
        assertThat(response.name()).isEqualTo("Data Structures");
        assertThat(response.syllabus()).isNotNull();
        assertThat(response.syllabus().pdfUrl()).isEqualTo("https://example.org/ds.pdf");
    }

    @Test
    @DisplayName("a concurrent code collision is retried with a freshly computed code")
    void createRetriesOnCodeCollision() {
        stubTransactions();
        when(subjectCodeGenerator.nextCode(AcademicDepartment.CS, 1)).thenReturn("CS101", "CS102");
        when(subjectRepository.saveAndFlush(any(Subject.class)))
                .thenThrow(uniqueViolation(SubjectService.SUBJECT_CODE_CONSTRAINT))
                .thenAnswer(invocation -> invocation.getArgument(0));

        SubjectResponse response = subjectService.create(STAFF,
                new CreateSubjectRequest("Algorithms", AcademicDepartment.CS, 1, null));

        assertThat(response.subjectCode()).isEqualTo("CS102");
        verify(subjectCodeGenerator, times(2)).nextCode(AcademicDepartment.CS, 1);
        verify(transactionManager).rollback(any());
        verify(syllabusRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("persistent collisions give up with a retryable conflict")
    void createGivesUpAfterMaxAttempts() {
        stubTransactions();
        when(subjectCodeGenerator.nextCode(AcademicDepartment.EE, 3)).thenReturn("EE301");
        when(subjectRepository.saveAndFlush(any(Subject.class)))
                .thenThrow(uniqueViolation(SubjectService.SUBJECT_CODE_CONSTRAINT));

        assertThatThrownBy(() -> subjectService.create(STAFF,
                new CreateSubjectRequest("Circuits", AcademicDepartment.EE, 3, null)))
                .isInstanceOfSatisfying(RetryableProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo("subject.code_conflict");
                });
        verify(subjectRepository, times(3)).saveAndFlush(any(Subject.class));
    }

    @Test
    @DisplayName("a duplicate name, department and semester is a validation error, not a retry")
    void createRejectsDuplicateIdentity() {
        stubTransactions();
        when(subjectRepository.existsByNameIgnoreCaseAndDepartmentAndSemester("Algorithms", AcademicDepartment.CS, 1))
                .thenReturn(true);

        assertThatThrownBy(() -> subjectService.create(STAFF,
                new CreateSubjectRequest("Algorithms", AcademicDepartment.CS, 1, null)))
                .isInstanceOfSatisfying(ValidationProblemException.class, ex -> {
                    assertThat(ex.getDetailMessage()).isEqualTo(SubjectService.DUPLICATE_SUBJECT_MESSAGE);
                    assertThat(ex.getFieldErrors()).containsKey("name");
                });
        verify(subjectCodeGenerator, never()).nextCode(any(), anyInt());
    }

    @Test
    @DisplayName("an identity constraint violation raced in by another writer maps to a validation error")
    void createMapsIdentityConstraintRace() {
        stubTransactions();
        when(subjectCodeGenerator.nextCode(AcademicDepartment.IT, 2)).thenReturn("IT201");
        when(subjectRepository.saveAndFlush(any(Subject.class)))
                .thenThrow(uniqueViolation(SubjectService.SUBJECT_IDENTITY_CONSTRAINT));

        assertThatThrownBy(() -> subjectService.create(STAFF,
                new CreateSubjectRequest("Networks", AcademicDepartment.IT, 2, null)))
                .isInstanceOf(ValidationProblemException.class);
        verify(subjectRepository, times(1)).saveAndFlush(any(Subject.class));
    }

    @Test
    @DisplayName("students cannot create subjects")
    void createRequiresStaffPrivilege() {
        assertThatThrownBy(() -> subjectService.create(STUDENT,
                new CreateSubjectRequest("Networks", AcademicDepartment.IT, 2, null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN));
        verifyNoInteractions(subjectRepository, subjectCodeGenerator, transactionManager);
    }

    @Test
    @DisplayName("update keeps the assigned code when the subject moves")
    void updateKeepsCode() {
        UUID id = UUID.randomUUID();
        Subject subject = new Subject("Algorithms", AcademicDepartment.CS, 1, "CS101");
        TestEntities.setId(subject, id);
        when(subjectRepository.findById(id)).thenReturn(Optional.of(subject));
        when(subjectRepository.existsByNameIgnoreCaseAndDepartmentAndSemesterAndIdNot(
                anyString(), eq(AcademicDepartment.IT), eq(4), eq(id))).thenReturn(false);
        when(syllabusRepository.findBySubjectId(id)).thenReturn(Optional.empty());
        when(subjectRepository.saveAndFlush(subject)).thenReturn(subject);

        SubjectResponse response = subjectService.update(STAFF, id,
                new UpdateSubjectRequest(
                        null, AcademicDepartment.IT, 4, null),
                false);

        assertThat(response.subjectCode()).isEqualTo("CS101");
        assertThat(response.department()).isEqualTo("IT");
        assertThat(response.semester()).isEqualTo(4);
    }

    private void stubTransactions() {
        when(transactionManager.getTransaction(any())).thenAnswer(invocation -> new SimpleTransactionStatus());
    }

    private static DataIntegrityViolationException uniqueViolation(String constraint) {
        return new DataIntegrityViolationException("could not execute statement",
                new IllegalStateException("duplicate key value violates unique constraint \"" + constraint + "\""));
    }
}
