package com.collegeportal.backend.modules.catalog.presentation;

import java.util.UUID;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.catalog.application.SyllabusService;
import com.collegeportal.backend.modules.catalog.application.SyllabusService.UpsertResult;
import com.collegeportal.backend.modules.catalog.presentation.dto.CatalogListResponse;
import com.collegeportal.backend.modules.catalog.presentation.dto.SyllabusResponse;
import com.collegeportal.backend.modules.catalog.presentation.dto.UpdateSyllabusRequest;
import com.collegeportal.backend.modules.catalog.presentation.dto.UpsertSyllabusRequest;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/syllabi")
public class SyllabusController {

    private final SyllabusService syllabusService;

    public SyllabusController(SyllabusService syllabusService) {
        this.syllabusService = syllabusService;
    }

    @GetMapping
    public ResponseEntity<CatalogListResponse<SyllabusResponse>> list(
            @RequestParam(name = "department", required = false) String department,
            @RequestParam(name = "semester", required = false) String semester
    ) {
        return ResponseEntity.ok(CatalogListResponse.of(syllabusService.list(
                SecurityUtils.currentActor(),
                CatalogParams.optionalDepartment(department),
                CatalogParams.optionalSemester(semester)
        )));
    }

    @Operation(summary = "Upload a syllabus", description = "Returns 201 when the subject had no syllabus, 200 when its URL was replaced.")
    @PostMapping
    public ResponseEntity<SyllabusResponse> upsert(@Valid @RequestBody UpsertSyllabusRequest request) {
        UpsertResult result = syllabusService.upsert(SecurityUtils.currentActor(), request.subject(), request.pdfUrl());
        return ResponseEntity.status(result.created() ? HttpStatus.CREATED : HttpStatus.OK).body(result.syllabus());
    }

    @GetMapping("/{id}")
    public ResponseEntity<SyllabusResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(syllabusService.get(SecurityUtils.currentActor(), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<SyllabusResponse> replace(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateSyllabusRequest request
    ) {
        return ResponseEntity.ok(syllabusService.update(SecurityUtils.currentActor(), id, request.pdfUrl()));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SyllabusResponse> update(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateSyllabusRequest request
    ) {
        return ResponseEntity.ok(syllabusService.update(SecurityUtils.currentActor(), id, request.pdfUrl()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        syllabusService.delete(SecurityUtils.currentActor(), id);
        return ResponseEntity.noContent().build();
    }
}
