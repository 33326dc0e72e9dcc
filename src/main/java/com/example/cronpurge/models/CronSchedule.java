package com.example.cronpurge.models;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structural view of a cron expression. Tokens are kept verbatim; no range checking happens here.
 * Fields left unset by the builder default to {@code *}, except {@code second} which defaults to {@code 0}.
 */
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@Builder(toBuilder = true)
@Getter
@EqualsAndHashCode
@ToString
public class CronSchedule {

    @Builder.Default
    private final String second = "0";

    @Builder.Default
    private final String minute = "*";

    @Builder.Default
    private final String hour = "*";

    @Builder.Default
    private final String dayOfMonth = "*";

    @Builder.Default
    private final String month = "*";

    @Builder.Default
    private final String dayOfWeek = "*";
}
