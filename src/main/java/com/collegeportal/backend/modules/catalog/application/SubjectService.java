package com.collegeportal.backend.modules.catalog.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.collegeportal.backend.global.error.ProblemException;
import com.collegeportal.backend.global.error.RetryableProblemException;
import com.collegeportal.backend.global.error.ValidationProblemException;
import com.collegeportal.backend.modules.access.domain.Actor;
import com.collegeportal.backend.modules.access.domain.PortalAction;
import com.collegeportal.backend.modules.access.domain.ResourceKind;
import com.collegeportal.backend.modules.access.domain.RolePolicy;
import com.collegeportal.backend.modules.catalog.domain.AcademicDepartment;
import com.collegeportal.backend.modules.catalog.domain.Subject;
import com.collegeportal.backend.modules.catalog.domain.Syllabus;
import com.collegeportal.backend.modules.catalog.infrastructure.persistence.SubjectRepository;
import com.collegeportal.backend.modules.catalog.infrastructure.persistence.SyllabusRepository;
import com.collegeportal.backend.modules.catalog.presentation.dto.CatalogDtoMapper;
import com.collegeportal.backend.modules.catalog.presentation.dto.CreateSubjectRequest;
import com.collegeportal.backend.modules.catalog.presentation.dto.SubjectResponse;
import com.collegeportal.backend.modules.catalog.presentation.dto.UpdateSubjectRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Subject catalog. Creation runs each attempt in its own transaction: when the generated code
 * collides with one committed concurrently, the attempt rolls back and a fresh code is computed.
 */
@Service
@Transactional
public class SubjectService {

    private static final Logger log = LoggerFactory.getLogger(SubjectService.class);

    static final String SUBJECT_CODE_CONSTRAINT = "uq_subject_code";
    static final String SUBJECT_IDENTITY_CONSTRAINT = "uq_subject_name_department_semester";
    static final String DUPLICATE_SUBJECT_MESSAGE = "The fields name, department, semester must make a unique set.";
    static final int RETRY_AFTER_SECONDS = 1;

    private final SubjectRepository subjectRepository;
    private final SyllabusRepository syllabusRepository;
    private final SubjectCodeGenerator subjectCodeGenerator;
    private final TransactionTemplate attemptTx;
    private final int maxAttempts;
    private final Clock clock;

    public SubjectService(
            SubjectRepository subjectRepository,
            SyllabusRepository syllabusRepository,
            SubjectCodeGenerator subjectCodeGenerator,
            PlatformTransactionManager transactionManager,
            @Value("${app.catalog.subject-code-max-attempts:5}") int maxAttempts,
            Clock clock
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("app.catalog.subject-code-max-attempts must be at least 1");
        }
        this.subjectRepository = subjectRepository;
        this.syllabusRepository = syllabusRepository;
        this.subjectCodeGenerator = subjectCodeGenerator;
        this.attemptTx = new TransactionTemplate(transactionManager);
        this.attemptTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    @Transactional(propagation = Propagation.NOT_SUPPORTED)
    public SubjectResponse create(Actor actor, CreateSubjectRequest request) {
        RolePolicy.require(actor, PortalAction.CREATE, ResourceKind.SUBJECT);
        String name = request.name().trim();
        String pdfUrl = blankToNull(request.pdfUrl());

        for (int attempt = 1; ; attempt++) {
            try {
                return attemptTx.execute(status -> insert(name, request.department(), request.semester(), pdfUrl));
            } catch (DataIntegrityViolationException ex) {
                String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
                if (message != null && message.contains(SUBJECT_IDENTITY_CONSTRAINT)) {
                    throw duplicateSubject();
                }
                if (message == null || !message.contains(SUBJECT_CODE_CONSTRAINT)) {
                    throw ex;
                }
                if (attempt >= maxAttempts) {
                    log.warn("Gave up assigning a subject code for {} semester {} after {} attempts",
                            request.department(), request.semester(), attempt);
                    throw new RetryableProblemException(HttpStatus.CONFLICT, "subject.code_conflict",
                            "Could not assign a unique subject code; please retry.", RETRY_AFTER_SECONDS);
                }
                log.info("Subject code collision for {} semester {} (attempt {}/{}), retrying",
                        request.department(), request.semester(), attempt, maxAttempts);
            }
        }
    }

    public SubjectResponse update(Actor actor, UUID id, UpdateSubjectRequest request, boolean replace) {
        RolePolicy.require(actor, PortalAction.UPDATE, ResourceKind.SUBJECT);
        Subject subject = findSubject(id);

        if (replace) {
            Map<String, String> errors = new LinkedHashMap<>();
            if (request.name() == null || request.name().isBlank()) {
                errors.put("name", "This field is required.");
            }
            if (request.department() == null) {
                errors.put("department", "This field is required.");
            }
            if (request.semester() == null) {
                errors.put("semester", "This field is required.");
            }
            if (!errors.isEmpty()) {
                throw new ValidationProblemException("Request could not be validated.", errors);
            }
        }

        String name = request.name() != null && !request.name().isBlank() ? request.name().trim() : subject.getName();
        AcademicDepartment department = request.department() != null ? request.department() : subject.getDepartment();
        int semester = request.semester() != null ? request.semester() : subject.getSemester();
        if (subjectRepository.existsByNameIgnoreCaseAndDepartmentAndSemesterAndIdNot(name, department, semester, id)) {
            throw duplicateSubject();
        }
        subject.rename(name);
        subject.moveTo(department, semester);

        String pdfUrl = blankToNull(request.pdfUrl());
        Syllabus syllabus = pdfUrl != null
                ? upsertSyllabus(subject, pdfUrl)
                : syllabusRepository.findBySubjectId(id).orElse(null);
        try {
            Subject saved = subjectRepository.saveAndFlush(subject);
            return CatalogDtoMapper.toResponse(saved, syllabus);
        } catch (DataIntegrityViolationException ex) {
            String message = NestedExceptionUtils.getMostSpecificCause(ex).getMessage();
            if (message != null && message.contains(SUBJECT_IDENTITY_CONSTRAINT)) {
                throw duplicateSubject();
            }
            throw ex;
        }
    }

    public void delete(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.DELETE, ResourceKind.SUBJECT);
        Subject subject = findSubject(id);
        syllabusRepository.deleteBySubjectId(id);
        subjectRepository.delete(subject);
        log.info("Deleted subject {}", subject.getSubjectCode());
    }

    @Transactional(readOnly = true)
    public SubjectResponse get(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.READ, ResourceKind.SUBJECT);
        Subject subject = findSubject(id);
        return CatalogDtoMapper.toResponse(subject, syllabusRepository.findBySubjectId(id).orElse(null));
    }

    /**
     * Subjects ordered by department, semester and name; both filters are optional.
     */
    @Transactional(readOnly = true)
    public List<SubjectResponse> list(Actor actor, AcademicDepartment department, Integer semester) {
        RolePolicy.require(actor, PortalAction.LIST, ResourceKind.SUBJECT);
        List<Subject> subjects = subjectRepository.search(department, semester);
        if (subjects.isEmpty()) {
            return List.of();
        }
        Map<UUID, Syllabus> syllabi = syllabusRepository.findAllBySubjectIdIn(
                        subjects.stream().map(Subject::getId).toList()).stream()
                .collect(Collectors.toMap(syllabus -> syllabus.getSubject().getId(), Function.identity()));
        return subjects.stream()
                .map(subject -> CatalogDtoMapper.toResponse(subject, syllabi.get(subject.getId())))
                .toList();
    }

    private SubjectResponse insert(String name, AcademicDepartment department, int semester, String pdfUrl) {
        if (subjectRepository.existsByNameIgnoreCaseAndDepartmentAndSemester(name, department, semester)) {
            throw duplicateSubject();
        }
        String code = subjectCodeGenerator.nextCode(department, semester);
        Subject saved = subjectRepository.saveAndFlush(new Subject(name, department, semester, code));
        Syllabus syllabus = null;
        if (pdfUrl != null) {
            syllabus = syllabusRepository.saveAndFlush(new Syllabus(saved, pdfUrl, OffsetDateTime.now(clock)));
        }
        log.info("Created subject {} ({})", code, name);
        return CatalogDtoMapper.toResponse(saved, syllabus);
    }

    private Syllabus upsertSyllabus(Subject subject, String pdfUrl) {
        Syllabus syllabus = syllabusRepository.findBySubjectId(subject.getId())
                .orElseGet(() -> new Syllabus(subject, pdfUrl, OffsetDateTime.now(clock)));
        syllabus.setPdfUrl(pdfUrl);
        return syllabusRepository.save(syllabus);
    }

    private Subject findSubject(UUID id) {
        return subjectRepository.findById(id)
                .orElseThrow(() -> ProblemException.notFound("subject.not_found", "Subject not found."));
    }

    private static ValidationProblemException duplicateSubject() {
        return new ValidationProblemException(DUPLICATE_SUBJECT_MESSAGE, Map.of("name", DUPLICATE_SUBJECT_MESSAGE));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
