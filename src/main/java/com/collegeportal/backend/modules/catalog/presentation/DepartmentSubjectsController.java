package com.collegeportal.backend.modules.catalog.presentation;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.catalog.application.SubjectService;
import com.collegeportal.backend.modules.catalog.presentation.dto.CatalogListResponse;
import com.collegeportal.backend.modules.catalog.presentation.dto.SubjectResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class DepartmentSubjectsController {

    private final SubjectService subjectService;

    public DepartmentSubjectsController(SubjectService subjectService) {
        this.subjectService = subjectService;
    }

    @GetMapping("/catalog/departments/{department}/subjects")
    public ResponseEntity<CatalogListResponse<SubjectResponse>> list(
            @PathVariable("department") String department,
            @RequestParam(name = "semester", required = false) String semester
    ) {
        return ResponseEntity.ok(CatalogListResponse.of(subjectService.list(
                SecurityUtils.currentActor(),
                CatalogParams.department(department),
                CatalogParams.optionalSemester(semester)
        )));
    }
}
