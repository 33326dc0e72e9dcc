package com.example.cronpurge.access;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.cronpurge.config.StatementStoreProperties;
import com.example.cronpurge.models.ScheduledStatement;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.testcontainers.containers.localstack.LocalStackContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeDefinition;
import software.amazon.awssdk.services.dynamodb.model.CreateTableRequest;
import software.amazon.awssdk.services.dynamodb.model.KeySchemaElement;
import software.amazon.awssdk.services.dynamodb.model.KeyType;
import software.amazon.awssdk.services.dynamodb.model.ResourceNotFoundException;
import software.amazon.awssdk.services.dynamodb.model.ScalarAttributeType;

@Testcontainers(disabledWithoutDocker = true)
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class DynamoScheduledStatementAccessTest {

    private static final DockerImageName LOCALSTACK_IMAGE = DockerImageName.parse("localstack/localstack:3.6");
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-10-02T08:00:00Z"), ZoneOffset.UTC);

    @Container
    private static final LocalStackContainer LOCALSTACK = new LocalStackContainer(LOCALSTACK_IMAGE)
            .withServices(LocalStackContainer.Service.DYNAMODB);

    private static final String TABLE = new StatementStoreProperties().getTable();

    private DynamoDbClient dynamo;
    private DynamoDbEnhancedClient enhancedClient;
    private ScheduledStatementAccess statementAccess;

    @BeforeAll
    void init() {
        AwsBasicCredentials creds = AwsBasicCredentials.create(
                LOCALSTACK.getAccessKey(), LOCALSTACK.getSecretKey());
        dynamo = DynamoDbClient.builder()
                .endpointOverride(LOCALSTACK.getEndpointOverride(LocalStackContainer.Service.DYNAMODB))
                .credentialsProvider(StaticCredentialsProvider.create(creds))
                .region(Region.of(LOCALSTACK.getRegion()))
                .build();
        enhancedClient = DynamoDbEnhancedClient.builder().dynamoDbClient(dynamo).build();
        ensureStatementsTable(TABLE);

        statementAccess = new DynamoScheduledStatementAccess(enhancedClient, new StatementStoreProperties());
    }

    @BeforeEach
    void cleanup() {
        var table = enhancedClient.table(TABLE,
                TableSchema.fromBean(ScheduledStatement.class));
        table.scan().items().forEach(table::deleteItem);
    }

    @Test
    @DisplayName("submit stores the statement and acknowledges with the stored item")
    void submitAndFind() {
        ScheduledStatement statement = statement("internal_core", "expurgo", "*/5 * * * *", "req-1");

        ScheduledStatement ack = statementAccess.submit(statement);
        Optional<ScheduledStatement> found = statementAccess.findByJobKey("internal_core-expurgo-job");

        assertEquals("internal_core-expurgo-job", ack.getJobKey());
        assertTrue(found.isPresent());
        assertEquals(statement.getStatement(), found.get().getStatement());
        assertEquals("*/5 * * * *", found.get().getCronExpression());
        assertEquals(CLOCK.millis(), found.get().getSubmittedAt());
        assertEquals("req-1", found.get().getRequestId());
    }

    @Test
    @DisplayName("resubmitting a job key replaces the earlier statement")
    void submitReplaces() {
        statementAccess.submit(statement("core", "cleanup", "0 3 * * *", "req-1"));
        statementAccess.submit(statement("core", "cleanup", "0 4 * * *", "req-2"));

        ScheduledStatement found = statementAccess.findByJobKey("core-cleanup-job").orElseThrow();

        assertEquals("0 4 * * *", found.getCronExpression());
        assertEquals("req-2", found.getRequestId());
    }

    @Test
    @DisplayName("findByJobKey is empty for unknown keys")
    void findMissing() {
        assertTrue(statementAccess.findByJobKey("nobody-nothing-job").isEmpty());
    }

    @Test
    @DisplayName("the configured table name decides where statements land")
    void submitToConfiguredTable() {
        StatementStoreProperties properties = new StatementStoreProperties();
        properties.setTable("scheduled_statements_staging");
        ensureStatementsTable(properties.getTable());
        ScheduledStatementAccess stagingAccess = new DynamoScheduledStatementAccess(enhancedClient, properties);

        stagingAccess.submit(statement("core", "staging", "0 5 * * *", "req-7"));

        assertTrue(stagingAccess.findByJobKey("core-staging-job").isPresent());
        assertTrue(statementAccess.findByJobKey("core-staging-job").isEmpty());
    }

    private ScheduledStatement statement(String databaseName, String jobName, String cron, String requestId) {
        String jobKey = databaseName + "-" + jobName + "-job";
        return ScheduledStatement.builder()
                .jobKey(jobKey)
                .databaseName(databaseName)
                .jobName(jobName)
                .cronExpression(cron)
                .statement("SELECT cron.schedule('" + jobKey + "', '" + cron + "', $$ select 1 $$, '" + databaseName + "');")
                .submittedAt(CLOCK.millis())
                .requestId(requestId)
                .build();
    }

    private void ensureStatementsTable(String tableName) {
        try {
            dynamo.describeTable(b -> b.tableName(tableName));
        } catch (ResourceNotFoundException ex) {
            dynamo.createTable(CreateTableRequest.builder()
                    .tableName(tableName)
                    .attributeDefinitions(
                            AttributeDefinition.builder().attributeName("job_key").attributeType(ScalarAttributeType.S).build())
                    .keySchema(
                            KeySchemaElement.builder().attributeName("job_key").keyType(KeyType.HASH).build())
                    .billingMode("PAY_PER_REQUEST")
                    .build());
        }
    }
}
