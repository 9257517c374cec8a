package com.collegeportal.backend.modules.notice.presentation;

import java.util.UUID;

import com.collegeportal.backend.global.security.SecurityUtils;
import com.collegeportal.backend.modules.notice.application.NoticeService;
import com.collegeportal.backend.modules.notice.presentation.dto.NoticeCleanupResponse;
import com.collegeportal.backend.modules.notice.presentation.dto.NoticeListResponse;
import com.collegeportal.backend.modules.notice.presentation.dto.NoticeRequest;
import com.collegeportal.backend.modules.notice.presentation.dto.NoticeResponse;

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
@RequestMapping("/notices")
public class NoticeController {

    private final NoticeService noticeService;

    public NoticeController(NoticeService noticeService) {
        this.noticeService = noticeService;
    }

    @Operation(summary = "List notices", description = "Students only receive unexpired notices addressed to all users.")
    @GetMapping
    public ResponseEntity<NoticeListResponse> list() {
        return ResponseEntity.ok(NoticeListResponse.of(noticeService.list(SecurityUtils.currentActor())));
    }

    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Notice created"),
            @ApiResponse(responseCode = "400", description = "Missing category, or neither title nor content given"),
            @ApiResponse(responseCode = "403", description = "Caller is a student")
    })
    @PostMapping
    public ResponseEntity<NoticeResponse> create(@Valid @RequestBody NoticeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(noticeService.create(SecurityUtils.currentActor(), request));
    }

    @GetMapping("/{id}")
    public ResponseEntity<NoticeResponse> get(@PathVariable("id") UUID id) {
        return ResponseEntity.ok(noticeService.get(SecurityUtils.currentActor(), id));
    }

    @PutMapping("/{id}")
    public ResponseEntity<NoticeResponse> replace(@PathVariable("id") UUID id, @Valid @RequestBody NoticeRequest request) {
        return ResponseEntity.ok(noticeService.update(SecurityUtils.currentActor(), id, request, true));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<NoticeResponse> update(@PathVariable("id") UUID id, @Valid @RequestBody NoticeRequest request) {
        return ResponseEntity.ok(noticeService.update(SecurityUtils.currentActor(), id, request, false));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") UUID id) {
        noticeService.delete(SecurityUtils.currentActor(), id);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Delete stale notices now", description = "Runs the scheduled cleanup on demand and returns how many notices were deleted.")
    @PostMapping("/cleanup")
    public ResponseEntity<NoticeCleanupResponse> cleanup() {
        return ResponseEntity.ok(new NoticeCleanupResponse(noticeService.purgeStale(SecurityUtils.currentActor())));
    }
}
