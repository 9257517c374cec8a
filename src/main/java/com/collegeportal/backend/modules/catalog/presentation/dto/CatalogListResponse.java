package com.collegeportal.backend.modules.catalog.presentation.dto;

import java.util.List;

public record CatalogListResponse<T>(int count, List<T> results) {

    public static <T> CatalogListResponse<T> of(List<T> results) {
        return new CatalogListResponse<>(results.size(), results);
    }
}
