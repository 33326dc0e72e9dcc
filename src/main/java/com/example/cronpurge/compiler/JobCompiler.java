package com.example.cronpurge.compiler;

import com.example.cronpurge.models.JobDefinition;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link JobDefinition} into the statement that registers its purge with pg_cron.
 * Stateless; the same definition always compiles to the same text.
 */
@Component
public class JobCompiler {

    private final CronNormalizer cronNormalizer;
    private final ThresholdEnforcer thresholdEnforcer;
    private final FilterClauseBuilder filterClauseBuilder;
    private final QueryAssembler queryAssembler;

    public JobCompiler(CronNormalizer cronNormalizer,
                       ThresholdEnforcer thresholdEnforcer,
                       FilterClauseBuilder filterClauseBuilder,
                       QueryAssembler queryAssembler) {
        this.cronNormalizer = cronNormalizer;
        this.thresholdEnforcer = thresholdEnforcer;
        this.filterClauseBuilder = filterClauseBuilder;
        this.queryAssembler = queryAssembler;
    }

    public CompiledJob compile(JobDefinition job) {
        if (job.filters().isEmpty()) {
            throw JobCompilerException.missingFilters();
        }

        String cron = cronNormalizer.normalize(job.cronExpression());

        String jobName = SqlIdentifiers.requireLiteralName("jobName", job.jobName());
        String databaseName = SqlIdentifiers.requireLiteralName("databaseName", job.databaseName());
        String schema = SqlIdentifiers.requireIdentifier("schema", job.schema());
        String table = SqlIdentifiers.requireIdentifier("table", job.table());

        List<String> adjustments = new ArrayList<>();
        ThresholdEnforcer.Clamped limit = thresholdEnforcer.limit(job.limit());
        if (limit.raised()) {
            adjustments.add("limit raised from " + limit.requested() + " to " + limit.effective());
        }

        FilterClauseBuilder.FilterClause clause = filterClauseBuilder.build(job.filters(), QueryAssembler.TABLE_ALIAS);
        for (int i = 0; i < clause.retentionDays().size(); i++) {
            ThresholdEnforcer.Clamped days = clause.retentionDays().get(i);
            if (days.raised()) {
                adjustments.add("filters[" + i + "].days raised from " + days.requested() + " to " + days.effective());
            }
        }

        String jobKey = QueryAssembler.jobKey(databaseName, jobName);
        String inner = queryAssembler.innerQuery(schema, table, clause.predicate(), limit.effective());
        String statement = queryAssembler.scheduleStatement(jobKey, cron, inner, databaseName);
        return new CompiledJob(jobKey, cron, statement, adjustments);
    }
}
