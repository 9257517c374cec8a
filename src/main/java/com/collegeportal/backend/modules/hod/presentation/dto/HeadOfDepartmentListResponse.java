package com.collegeportal.backend.modules.hod.presentation.dto;

import java.util.List;

public record HeadOfDepartmentListResponse(int count, List<HeadOfDepartmentResponse> results) {

    public static HeadOfDepartmentListResponse of(List<HeadOfDepartmentResponse> results) {
        return new HeadOfDepartmentListResponse(results.size(), results);
    }
}
