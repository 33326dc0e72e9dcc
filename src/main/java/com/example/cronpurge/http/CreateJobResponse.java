package com.example.cronpurge.http;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CreateJobResponse(
        @JsonProperty("job_key") String jobKey,
        @JsonProperty("cron_expression") String cronExpression,
        @JsonProperty("statement") String statement,
        @JsonProperty("adjustments") List<String> adjustments,
        @JsonProperty("submitted_at") Long submittedAt
) {}
