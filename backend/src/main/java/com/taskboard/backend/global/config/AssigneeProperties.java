package com.taskboard.backend.global.config;

import jakarta.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Paging limits for assignee listings.
 *
 * @param defaultPageSize page size used when the caller sends none or a non-positive one
 * @param maxPageSize     upper bound applied to any requested page size
 */
@Validated
@ConfigurationProperties(prefix = "taskboard.assignees")
public record AssigneeProperties(
        @Min(1) int defaultPageSize,
        @Min(1) int maxPageSize
) {

    public AssigneeProperties {
        if (defaultPageSize > maxPageSize) {
            throw new IllegalArgumentException(
                    "taskboard.assignees.default-page-size must not exceed max-page-size");
        }
    }

    public int resolvePageSize(Integer requested) {
        if (requested == null || requested <= 0) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }
}
