package com.example.cronpurge.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * HTTP-layer payload captured from client POST /jobs requests. Either {@code cron_expression} or
 * {@code schedule} supplies the timing; an empty {@code filters} list is left for the compiler to
 * reject so the client gets the dedicated error code.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateJobHttpRequest(
        @JsonProperty("job_name") @NotBlank String jobName,
        @JsonProperty("cron_expression") String cronExpression,
        @JsonProperty("schedule") CronScheduleHttpRequest schedule,
        @JsonProperty("database_name") @NotBlank String databaseName,
        @JsonProperty("schema") @NotBlank String schema,
        @JsonProperty("table") @NotBlank String table,
        @JsonProperty("limit") Integer limit,
        @JsonProperty("filters") List<@Valid @NotNull RetentionFilterHttpRequest> filters
) {}
