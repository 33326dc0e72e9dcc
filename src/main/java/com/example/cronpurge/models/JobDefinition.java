package com.example.cronpurge.models;

import java.util.List;
import java.util.Objects;
import lombok.Builder;

/**
 * Immutable cleanup job request handed to the compiler. A missing filter list is normalized to an
 * empty one so that the compiler reports it as a missing-filters failure rather than a null pointer.
 */
@Builder(toBuilder = true)
public record JobDefinition(
        String jobName,
        String cronExpression,
        String databaseName,
        String schema,
        String table,
        Integer limit,
        List<RetentionFilter> filters
) {

    public JobDefinition {
        Objects.requireNonNull(jobName, "jobName");
        if (jobName.isBlank()) {
            throw new IllegalArgumentException("jobName must be non-blank");
        }

        Objects.requireNonNull(cronExpression, "cronExpression");

        Objects.requireNonNull(databaseName, "databaseName");
        if (databaseName.isBlank()) {
            throw new IllegalArgumentException("databaseName must be non-blank");
        }

        Objects.requireNonNull(schema, "schema");
        Objects.requireNonNull(table, "table");

        filters = filters == null ? List.of() : List.copyOf(filters);
    }
}
