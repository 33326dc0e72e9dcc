package com.example.cronpurge.models;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.NonNull;
import lombok.Setter;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbAttribute;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbPartitionKey;

/**
 * Last scheduler registration statement submitted for a job key. Only the generated SQL and the
 * identifiers it was derived from are stored.
 */
@JsonInclude(Include.NON_NULL)
@DynamoDbBean
@NoArgsConstructor                     // required by DynamoDB Enhanced Client
@AllArgsConstructor(access = AccessLevel.PRIVATE) // used by Lombok @Builder
@Builder(toBuilder = true)
@Getter @Setter
public class ScheduledStatement {

    @NonNull private String jobKey;      // PK "{database}-{job}-job"
    @NonNull private String databaseName;
    @NonNull private String jobName;
    @NonNull private String cronExpression;
    @NonNull private String statement;
    @NonNull private Long submittedAt;

    private String requestId;

    @DynamoDbPartitionKey
    @DynamoDbAttribute("job_key")
    public String getJobKey() { return jobKey; }

    @DynamoDbAttribute("database_name")
    public String getDatabaseName() { return databaseName; }

    @DynamoDbAttribute("job_name")
    public String getJobName() { return jobName; }

    @DynamoDbAttribute("cron_expression")
    public String getCronExpression() { return cronExpression; }

    @DynamoDbAttribute("statement")
    public String getStatement() { return statement; }

    @DynamoDbAttribute("submitted_at")
    public Long getSubmittedAt() { return submittedAt; }

    @DynamoDbAttribute("request_id")
    public String getRequestId() { return requestId; }
}
