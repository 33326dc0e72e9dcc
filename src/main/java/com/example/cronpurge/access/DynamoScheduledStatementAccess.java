package com.example.cronpurge.access;

import com.example.cronpurge.config.StatementStoreProperties;
import com.example.cronpurge.models.ScheduledStatement;
import java.util.Optional;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.Key;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

@Component
public class DynamoScheduledStatementAccess implements ScheduledStatementAccess {

    private final DynamoDbTable<ScheduledStatement> table;

    public DynamoScheduledStatementAccess(DynamoDbEnhancedClient enhancedClient, StatementStoreProperties properties) {
        this.table = enhancedClient.table(properties.getTable(), TableSchema.fromBean(ScheduledStatement.class));
    }

    @Override
    public ScheduledStatement submit(ScheduledStatement statement) {
        table.putItem(statement);
        return statement;
    }

    @Override
    public Optional<ScheduledStatement> findByJobKey(String jobKey) {
        return Optional.ofNullable(table.getItem(Key.builder().partitionValue(jobKey).build()));
    }
}
