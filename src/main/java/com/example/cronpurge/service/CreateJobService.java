package com.example.cronpurge.service;

import com.example.cronpurge.access.ScheduledStatementAccess;
import com.example.cronpurge.compiler.CompiledJob;
import com.example.cronpurge.compiler.CronNormalizer;
import com.example.cronpurge.compiler.JobCompiler;
import com.example.cronpurge.compiler.JobCompilerException;
import com.example.cronpurge.models.CronSchedule;
import com.example.cronpurge.models.JobDefinition;
import com.example.cronpurge.models.ScheduledStatement;
import java.time.Clock;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Compiles cleanup job definitions and hands the resulting pg_cron statement to the statement
 * store. Each successful compile is submitted exactly once; submission failures propagate to the
 * caller untouched.
 */
@Service
@Slf4j
public class CreateJobService {

    private final JobCompiler jobCompiler;
    private final CronNormalizer cronNormalizer;
    private final ScheduledStatementAccess statementAccess;
    private final Clock clock;

    public CreateJobService(JobCompiler jobCompiler,
                            CronNormalizer cronNormalizer,
                            ScheduledStatementAccess statementAccess,
                            Clock clock) {
        this.jobCompiler = jobCompiler;
        this.cronNormalizer = cronNormalizer;
        this.statementAccess = statementAccess;
        this.clock = clock;
    }

    /**
     * Picks the cron string for a request: an explicit expression wins, otherwise the structured
     * schedule is formatted and validated.
     */
    public String resolveCronExpression(String expression, CronSchedule schedule, boolean includeSeconds) {
        if (expression != null && !expression.isBlank()) {
            return expression;
        }
        if (schedule == null) {
            throw JobCompilerException.invalidCronFormat(String.valueOf(expression));
        }
        return cronNormalizer.format(schedule, includeSeconds);
    }

    public CreateJobResult createJob(JobDefinition job, String requestId) {
        Objects.requireNonNull(job, "job");

        CompiledJob compiled = jobCompiler.compile(job);
        for (String adjustment : compiled.adjustments()) {
            log.warn("[{}] Job {}: {}", requestId, compiled.jobKey(), adjustment);
        }
        log.info("[{}] Compiled job {} for {}.{} with {} filter(s), schedule '{}'",
                requestId, compiled.jobKey(), job.schema(), job.table(), job.filters().size(),
                compiled.cronExpression());
        log.debug("[{}] Statement for {}: {}", requestId, compiled.jobKey(), compiled.statement());

        ScheduledStatement stored = statementAccess.submit(ScheduledStatement.builder()
                .jobKey(compiled.jobKey())
                .databaseName(job.databaseName())
                .jobName(job.jobName())
                .cronExpression(compiled.cronExpression())
                .statement(compiled.statement())
                .submittedAt(clock.millis())
                .requestId(requestId)
                .build());

        log.info("[{}] Submitted statement for job {}", requestId, stored.getJobKey());
        return new CreateJobResult(compiled, stored);
    }

    public ScheduledStatement findStatement(String jobKey) {
        Objects.requireNonNull(jobKey, "jobKey");
        return statementAccess.findByJobKey(jobKey)
                .orElseThrow(() -> JobCompilerException.jobNotFound(jobKey));
    }

    public record CreateJobResult(
            CompiledJob compiled,
            ScheduledStatement stored
    ) { }
}
