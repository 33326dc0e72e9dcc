package com.example.cronpurge.http;

import com.example.cronpurge.compiler.CompiledJob;
import com.example.cronpurge.models.CronSchedule;
import com.example.cronpurge.models.JobDefinition;
import com.example.cronpurge.models.RetentionFilter;
import com.example.cronpurge.models.ScheduledStatement;
import com.example.cronpurge.requests.CreateJobHttpRequest;
import com.example.cronpurge.requests.CronScheduleHttpRequest;
import com.example.cronpurge.service.CreateJobService;
import com.example.cronpurge.service.CreateJobService.CreateJobResult;
import jakarta.validation.Valid;
import java.util.List;
import org.slf4j.MDC;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST entry point for cleanup jobs. Converts the HTTP payload into a {@link JobDefinition},
 * has it compiled and submitted, and echoes the generated statement back to the caller together
 * with any thresholds that were applied.
 */
@RestController
public class JobController {

    private final CreateJobService jobService;

    public JobController(CreateJobService jobService) {
        this.jobService = jobService;
    }

    @PostMapping("/jobs")
    public ResponseEntity<CreateJobResponse> createJob(@Valid @RequestBody CreateJobHttpRequest request) {
        // populated by RequestIdFilter for every request
        String requestId = MDC.get(RequestIdFilter.MDC_KEY);

        CronScheduleHttpRequest schedule = request.schedule();
        String cronExpression = jobService.resolveCronExpression(
                request.cronExpression(),
                schedule != null ? map(schedule) : null,
                schedule != null && schedule.includeSeconds());

        List<RetentionFilter> filters = request.filters() == null ? null : request.filters().stream()
                .map(filter -> new RetentionFilter(filter.column(), filter.days()))
                .toList();

        JobDefinition job = JobDefinition.builder()
                .jobName(request.jobName())
                .cronExpression(cronExpression)
                .databaseName(request.databaseName())
                .schema(request.schema())
                .table(request.table())
                .limit(request.limit())
                .filters(filters)
                .build();

        CreateJobResult result = jobService.createJob(job, requestId);
        CompiledJob compiled = result.compiled();

        return ResponseEntity.ok()
                .header(RequestIdFilter.HEADER, requestId)
                .body(new CreateJobResponse(
                        compiled.jobKey(),
                        compiled.cronExpression(),
                        compiled.statement(),
                        compiled.adjustments(),
                        result.stored().getSubmittedAt()
                ));
    }

    @GetMapping("/jobs/{jobKey}")
    public ResponseEntity<ScheduledStatementResponse> getJob(@PathVariable String jobKey) {
        ScheduledStatement statement = jobService.findStatement(jobKey);
        return ResponseEntity.ok(new ScheduledStatementResponse(
                statement.getJobKey(),
                statement.getDatabaseName(),
                statement.getJobName(),
                statement.getCronExpression(),
                statement.getStatement(),
                statement.getSubmittedAt(),
                statement.getRequestId()
        ));
    }

    private CronSchedule map(CronScheduleHttpRequest schedule) {
        // blank and missing fields are defaulted by the formatter
        return CronSchedule.builder()
                .second(schedule.second())
                .minute(schedule.minute())
                .hour(schedule.hour())
                .dayOfMonth(schedule.dayOfMonth())
                .month(schedule.month())
                .dayOfWeek(schedule.dayOfWeek())
                .build();
    }
}
