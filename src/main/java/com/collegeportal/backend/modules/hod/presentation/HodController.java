package com.collegeportal.backend.modules.hod.presentation;

import java.util.UUID;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.hod.application.HodSuccessionService;
import com.collegeportal.backend.modules.hod.application.HodSuccessionService.AppointCommand;
import com.collegeportal.backend.modules.hod.application.HodSuccessionService.UpdateCommand;
import com.collegeportal.backend.modules.hod.presentation.dto.AppointHodRequest;
import com.collegeportal.backend.modules.hod.presentation.dto.HeadOfDepartmentListResponse;
import com.collegeportal.backend.modules.hod.presentation.dto.HeadOfDepartmentResponse;
import com.collegeportal.backend.modules.hod.presentation.dto.UpdateHodRequest;
import com.collegeportal.backend.modules.people.domain.Department;

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
@RequestMapping("/hods")
public class HodController {

    private final HodSuccessionService hodSuccessionService;

    public HodController(HodSuccessionService hodSuccessionService) {
        this.hodSuccessionService = hodSuccessionService;
    }

    @GetMapping
    public ResponseEntity<HeadOfDepartmentListResponse> list(
            @RequestParam(name = "department", required = false) String department,
            @RequestParam(name = "active", required = false) Boolean active
    ) {
        Department filter = DepartmentParam.parseOptional(department);
        return ResponseEntity.ok(HeadOfDepartmentListResponse.of(
                hodSuccessionService.list(SecurityUtils.currentActor(), filter, active)));
    }

    @Operation(
            summary = "Appoint a head of department",
            description = """
                    Appoints a staff member as head of a department. \
                    If the department already has an active head the request fails with 409 \
                    unless `replaceIncumbent` is true, in which case the incumbent is retired in the same transaction.
                    """
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Appointment created"),
            @ApiResponse(responseCode = "400", description = "Inactive staff member"),
            @ApiResponse(responseCode = "404", description = "Unknown staff id"),
            @ApiResponse(responseCode = "409", description = "Department occupied or staff member already heads a department")
    })
    @PostMapping
    public ResponseEntity<HeadOfDepartmentResponse> appoint(@Valid @RequestBody AppointHodRequest request) {
        AppointCommand command = new AppointCommand(
                request.staffId().trim(),
                request.department(),
                request.startDate(),
                blankToNull(request.notes()),
                Boolean.TRUE.equals(request.replaceIncumbent())
        );
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(hodSuccessionService.appoint(SecurityUtils.currentActor(), command));
    }

    @GetMapping("/{id}")
    public ResponseEntity<HeadOfDepartmentResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(hodSuccessionService.get(SecurityUtils.currentActor(), id));
    }

    @Operation(
            summary = "Replace an appointment",
            description = "Changing the department retires this appointment and returns a new one for the new department."
    )
    @PutMapping("/{id}")
    public ResponseEntity<HeadOfDepartmentResponse> replace(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateHodRequest request
    ) {
        return ResponseEntity.ok(hodSuccessionService.update(SecurityUtils.currentActor(), id, toCommand(request, true)));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<HeadOfDepartmentResponse> update(
            @PathVariable("id") UUID id,
            @Valid @RequestBody UpdateHodRequest request
    ) {
        return ResponseEntity.ok(hodSuccessionService.update(SecurityUtils.currentActor(), id, toCommand(request, false)));
    }

    @Operation(summary = "Retire an appointment", description = "Soft delete: the row is kept as history.")
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> retire(@PathVariable("id") UUID id) {
        hodSuccessionService.retire(SecurityUtils.currentActor(), id);
        return ResponseEntity.noContent().build();
    }

    private static UpdateCommand toCommand(UpdateHodRequest request, boolean replace) {
        return new UpdateCommand(
                request.department(),
                request.startDate(),
                request.endDate(),
                request.active(),
                blankToNull(request.notes()),
                replace
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
