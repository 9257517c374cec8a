package com.collegeportal.backend.modules.catalog.application;

import com.collegeportal.backend.modules.catalog.domain.AcademicDepartment;
import com.collegeportal.backend.modules.catalog.domain.SubjectCodeFormatter;
import com.collegeportal.backend.modules.catalog.infrastructure.persistence.SubjectRepository;

import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

/**
 * Computes the next code for a department and semester from the highest stored code carrying
 * that prefix. Codes stay with a subject that moves, so the lookup goes by code, not by the
 * subject's current department and semester.
 * Two concurrent callers can compute the same code; the unique constraint on
 * {@code subject.subject_code} rejects the second insert and {@link SubjectService} retries.
 */
@Component
public class SubjectCodeGenerator {

    private final SubjectRepository subjectRepository;

    public SubjectCodeGenerator(SubjectRepository subjectRepository) {
        this.subjectRepository = subjectRepository;
    }

    public String nextCode(AcademicDepartment department, int semester) {
        String prefix = SubjectCodeFormatter.prefix(department, semester);
        String lastCode = subjectRepository.findHighestCodesWithPrefix(prefix, PageRequest.of(0, 1)).stream()
                .findFirst()
                .orElse(null);
        int sequence = SubjectCodeFormatter.nextSequence(lastCode, department, semester);
        return SubjectCodeFormatter.format(department, semester, sequence);
    }
}
