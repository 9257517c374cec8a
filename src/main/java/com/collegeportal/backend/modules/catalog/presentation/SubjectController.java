package com.collegeportal.backend.modules.catalog.presentation;

import java.util.UUID;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.catalog.application.SubjectService;
import com.collegeportal.backend.modules.catalog.presentation.dto.CatalogListResponse;
import com.collegeportal.backend.modules.catalog.presentation.dto.CreateSubjectRequest;
import com.collegeportal.backend.modules.catalog.presentation.dto.SubjectResponse;
import com.collegeportal.backend.modules.catalog.presentation.dto.UpdateSubjectRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

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
@RequestMapping("/subjects")
public class SubjectController {

    private final SubjectService subjectService;

    public SubjectController(SubjectService subjectService) {
        this.subjectService = subjectService;
    }

    @GetMapping
    public ResponseEntity<CatalogListResponse<SubjectResponse>> list(
            @RequestParam(name = "department", required = false) String department,
            @RequestParam(name = "semester", required = false) String semester
    ) {
        return ResponseEntity.ok(CatalogListResponse.of(subjectService.list(
                SecurityUtils.currentActor(),
                CatalogParams.optionalDepartment(department),
                CatalogParams.optionalSemester(semester)
        )));
    }

    @Operation(
            summary = "Create a subject",
            description = "The subject code is generated from department, semester and the next free sequence (CS101, CS102, ...)."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Subject created"),
            @ApiResponse(responseCode = "400", description = "Invalid input or duplicate name in the same department and semester"),
            @ApiResponse(responseCode = "409", description = "No unique code could be assigned; retry after the Retry-After delay")
    })
    @PostMapping
    public ResponseEntity<SubjectResponse> create(@Valid @RequestBody CreateSubjectRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(subjectService.create(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<SubjectResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(subjectService.get(SecurityUtils.currentActor(), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<SubjectResponse> replace(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateSubjectRequest request
    ) {
        return ResponseEntity.ok(subjectService.update(SecurityUtils.currentActor(), id, request, true));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<SubjectResponse> update(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateSubjectRequest request
    ) {
        return ResponseEntity.ok(subjectService.update(SecurityUtils.currentActor(), id, request, false));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        subjectService.delete(SecurityUtils.currentActor(), id);
        return ResponseEntity.noContent().build();
    }
}
