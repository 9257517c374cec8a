package com.collegeportal.backend.modules.people.presentation.dto;

import java.util.List;

public record PeopleListResponse<T>(int count, List<T> results) {

    public static <T> PeopleListResponse<T> of(List<T> results) {
        return new PeopleListResponse<>(results.size(), results);
    }
}
