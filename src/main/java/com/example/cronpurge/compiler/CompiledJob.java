package com.example.cronpurge.compiler;

import java.util.List;

/**
 * Output of {@link JobCompiler}.
 *
 * @param jobKey name the job is registered under, {@code {database}-{job}-job}
 * @param cronExpression normalized schedule embedded in the statement
 * @param statement complete {@code SELECT cron.schedule(...)} text
 * @param adjustments human readable notes for every value raised to its minimum
 */
public record CompiledJob(
        String jobKey,
        String cronExpression,
        String statement,
        List<String> adjustments
) {

    public CompiledJob {
        adjustments = adjustments == null ? List.of() : List.copyOf(adjustments);
    }
}
