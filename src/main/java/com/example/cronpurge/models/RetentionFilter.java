package com.example.cronpurge.models;

import java.util.Objects;

/**
 * Deletes rows whose {@code column} timestamp is older than {@code days} days.
 */
public record RetentionFilter(String column, int days) {

    public RetentionFilter {
        Objects.requireNonNull(column, "column");
        if (column.isBlank()) {
            throw new IllegalArgumentException("column must be non-blank");
        }
    }
}
