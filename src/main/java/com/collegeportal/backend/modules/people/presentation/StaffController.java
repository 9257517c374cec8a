package com.collegeportal.backend.modules.people.presentation;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.people.application.StaffService;
import com.collegeportal.backend.modules.people.presentation.dto.CreateStaffRequest;
import com.collegeportal.backend.modules.people.presentation.dto.PeopleListResponse;
import com.collegeportal.backend.modules.people.presentation.dto.StaffResponse;
import com.collegeportal.backend.modules.people.presentation.dto.UpdateStaffRequest;

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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/staff")
public class StaffController {

    private final StaffService staffService;

    public StaffController(StaffService staffService) {
        this.staffService = staffService;
    }

    @GetMapping
    public ResponseEntity<PeopleListResponse<StaffResponse>> list() {
        return ResponseEntity.ok(PeopleListResponse.of(staffService.listStaff(SecurityUtils.currentActor())));
    }

    @PostMapping
    public ResponseEntity<StaffResponse> add(@Valid @RequestBody CreateStaffRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(staffService.addStaff(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/{staffId}")
    public ResponseEntity<StaffResponse> get(@PathVariable("staffId") String staffId) {
        return ResponseEntity.ok(staffService.getStaff(SecurityUtils.currentActor(), staffId));
    }

    @PutMapping("/{staffId}")
    public ResponseEntity<StaffResponse> replace(
            @PathVariable("staffId") String staffId,
            @Valid @RequestBody UpdateStaffRequest request
    ) {
        return ResponseEntity.ok(staffService.updateStaff(SecurityUtils.currentActor(), staffId, request, true));
    }

    @PatchMapping("/{staffId}")
    public ResponseEntity<StaffResponse> update(
            @PathVariable("staffId") String staffId,
            @Valid @RequestBody UpdateStaffRequest request
    ) {
        return ResponseEntity.ok(staffService.updateStaff(SecurityUtils.currentActor(), staffId, request, false));
    }

    @Operation(
            summary = "Delete a staff member",
            description = "Active head-of-department appointments are retired or block the deletion, "
                    + "depending on app.hod.staff-removal-policy."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Staff member and account deleted"),
            @ApiResponse(responseCode = "409", description = "Staff member is an active HOD and the policy is BLOCK")
    })
    @DeleteMapping("/{staffId}")
    public ResponseEntity<Void> delete(@PathVariable("staffId") String staffId) {
        staffService.deleteStaff(SecurityUtils.currentActor(), staffId);
        return ResponseEntity.noContent().build();
    }
}
