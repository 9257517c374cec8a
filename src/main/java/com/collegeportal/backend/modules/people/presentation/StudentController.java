package com.collegeportal.backend.modules.people.presentation;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.people.application.StudentService;
import com.collegeportal.backend.modules.people.presentation.dto.CreateStudentRequest;
import com.collegeportal.backend.modules.people.presentation.dto.PeopleListResponse;
import com.collegeportal.backend.modules.people.presentation.dto.StudentResponse;
import com.collegeportal.backend.modules.people.presentation.dto.UpdateStudentRequest;

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
@RequestMapping("/students")
public class StudentController {

    private final StudentService studentService;

    public StudentController(StudentService studentService) {
        this.studentService = studentService;
    }

    @GetMapping
    public ResponseEntity<PeopleListResponse<StudentResponse>> list() {
        return ResponseEntity.ok(PeopleListResponse.of(studentService.listStudents(SecurityUtils.currentActor())));
    }

    @Operation(summary = "Add a student", description = "Creates the login account and the student profile together.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Student created"),
            @ApiResponse(responseCode = "400", description = "Password mismatch, duplicate email or student id"),
            @ApiResponse(responseCode = "403", description = "Caller is neither admin nor staff")
    })
    @PostMapping
    public ResponseEntity<StudentResponse> add(@Valid @RequestBody CreateStudentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(studentService.addStudent(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/{studentId}")
    public ResponseEntity<StudentResponse> get(@PathVariable("studentId") String studentId) {
        return ResponseEntity.ok(studentService.getStudent(SecurityUtils.currentActor(), studentId));
    }

    @PutMapping("/{studentId}")
    public ResponseEntity<StudentResponse> replace(
            @PathVariable("studentId") String studentId,
            @Valid @RequestBody UpdateStudentRequest request
    ) {
        return ResponseEntity.ok(studentService.updateStudent(SecurityUtils.currentActor(), studentId, request, true));
    }

    @PatchMapping("/{studentId}")
    public ResponseEntity<StudentResponse> update(
            @PathVariable("studentId") String studentId,
            @Valid @RequestBody UpdateStudentRequest request
    ) {
        return ResponseEntity.ok(studentService.updateStudent(SecurityUtils.currentActor(), studentId, request, false));
    }

    @Operation(summary = "Delete a student", description = "Deletes the profile and the linked user account.")
    @DeleteMapping("/{studentId}")
    public ResponseEntity<Void> delete(@PathVariable("studentId") String studentId) {
        studentService.deleteStudent(SecurityUtils.currentActor(), studentId);
        return ResponseEntity.noContent().build();
    }
}
