package io.heygw44.hive.domain.community.dto;

import io.heygw44.hive.domain.community.entity.Category;

public record CategoryResponse(
    Long id,
    String name,
    String title,
    String color
) {
    public static CategoryResponse from(Category category) {
        return new CategoryResponse(
            category.getId(),
            category.getName(),
            category.getTitle(),
            category.getColor()
        );
    }
}
