package com.example.cronpurge.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduledStatementResponse(
        @JsonProperty("job_key") String jobKey,
        @JsonProperty("database_name") String databaseName,
        @JsonProperty("job_name") String jobName,
        @JsonProperty("cron_expression") String cronExpression,
        @JsonProperty("statement") String statement,
        @JsonProperty("submitted_at") Long submittedAt,
        @JsonProperty("request_id") String requestId
) {}
