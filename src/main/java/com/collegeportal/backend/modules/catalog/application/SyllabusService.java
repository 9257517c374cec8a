package com.collegeportal.backend.modules.catalog.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.collegeportal.backend.global.error.ProblemException;
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
import com.collegeportal.backend.modules.catalog.presentation.dto.SyllabusResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SyllabusService {

    private final SyllabusRepository syllabusRepository;
    private final SubjectRepository subjectRepository;
    private final Clock clock;

    public SyllabusService(SyllabusRepository syllabusRepository, SubjectRepository subjectRepository, Clock clock) {
        this.syllabusRepository = syllabusRepository;
        this.subjectRepository = subjectRepository;
        this.clock = clock;
    }

    /**
     * Creates the subject's syllabus or replaces its URL.
     */
    public UpsertResult upsert(Actor actor, UUID subjectId, String pdfUrl) {
        RolePolicy.require(actor, PortalAction.CREATE, ResourceKind.SYLLABUS);
        String url = pdfUrl == null || pdfUrl.isBlank() ? null : pdfUrl.trim();
        if (subjectId == null || url == null) {
            Map<String, String> errors = new LinkedHashMap<>();
            if (subjectId == null) {
                errors.put("subject", "This field is required.");
            }
            if (url == null) {
                errors.put("pdfUrl", "This field is required.");
            }
            throw new ValidationProblemException("Both subject ID and PDF URL are required", errors);
        }

        Subject subject = subjectRepository.findById(subjectId)
                .orElseThrow(() -> ProblemException.notFound("subject.not_found", "Subject not found"));
        Syllabus existing = syllabusRepository.findBySubjectId(subjectId).orElse(null);
        if (existing != null) {
            existing.setPdfUrl(url);
            return new UpsertResult(CatalogDtoMapper.toResponse(syllabusRepository.save(existing)), false);
        }
        Syllabus created = syllabusRepository.save(new Syllabus(subject, url, OffsetDateTime.now(clock)));
        return new UpsertResult(CatalogDtoMapper.toResponse(created), true);
    }

    @Transactional(readOnly = true)
    public List<SyllabusResponse> list(Actor actor, AcademicDepartment department, Integer semester) {
        RolePolicy.require(actor, PortalAction.LIST, ResourceKind.SYLLABUS);
        return syllabusRepository.search(department, semester).stream()
                .map(CatalogDtoMapper::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public SyllabusResponse get(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.READ, ResourceKind.SYLLABUS);
        return CatalogDtoMapper.toResponse(findSyllabus(id));
    }

    public SyllabusResponse update(Actor actor, UUID id, String pdfUrl) {
        RolePolicy.require(actor, PortalAction.UPDATE, ResourceKind.SYLLABUS);
        Syllabus syllabus = findSyllabus(id);
        syllabus.setPdfUrl(pdfUrl.trim());
        return CatalogDtoMapper.toResponse(syllabusRepository.save(syllabus));
    }

    public void delete(Actor actor, UUID id) {
        RolePolicy.require(actor, PortalAction.DELETE, ResourceKind.SYLLABUS);
        syllabusRepository.delete(findSyllabus(id));
    }

    private Syllabus findSyllabus(UUID id) {
        return syllabusRepository.findWithSubjectById(id)
                .orElseThrow(() -> ProblemException.notFound("syllabus.not_found", "Syllabus not found."));
    }

    public record UpsertResult(SyllabusResponse syllabus, boolean created) {
    }
}
