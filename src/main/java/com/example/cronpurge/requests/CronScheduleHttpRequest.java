package com.example.cronpurge.requests;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Field-by-field alternative to a cron string. Omitted fields fall back to {@code *}
 * ({@code 0} for seconds); seconds are only emitted when {@code include_seconds} is true.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CronScheduleHttpRequest(
        @JsonProperty("second") String second,
        @JsonProperty("minute") String minute,
        @JsonProperty("hour") String hour,
        @JsonProperty("day_of_month") String dayOfMonth,
        @JsonProperty("month") String month,
        @JsonProperty("day_of_week") String dayOfWeek,
        @JsonProperty("include_seconds") boolean includeSeconds
) {}
